package biowiki.server;

import biowiki.router.PathRouter;
import biowiki.store.WebCollection;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.TimeoutHandler;

import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * HTTP front end of the wiki store.
 *
 * <p>Vert.x Web reads the whole request body before {@link WikiRequestHandler} classifies
 * the request with {@link PathRouter#wiki()}; route matching itself is not delegated to
 * Vert.x Web.
 */
public final class WikiServer {
  private static final Logger LOG = Logger.getLogger(WikiServer.class.getName());

  private final Vertx vertx;
  private final WikiConfig config;
  private final WebCollection webs;
  private HttpServer server;

  public WikiServer(Vertx vertx, WikiConfig config) {
    this.vertx = vertx;
    this.config = config;
    String dataDir = Objects.requireNonNull(config.dataDir(), "dataDir");
    this.webs = new WebCollection(vertx.fileSystem(), Path.of(dataDir));
  }

  Router router() {
    Router router = Router.router(vertx);
    router.route().handler(BodyHandler.create(false).setBodyLimit(config.bodyLimitBytes()));
    router.route().handler(TimeoutHandler.create(config.requestTimeoutMillis()));
    router.route().handler(new WikiRequestHandler(vertx, webs, PathRouter.wiki(), config.lockTimeoutMillis()));
    return router;
  }

  public Future<HttpServer> start() {
    HttpServerOptions options = new HttpServerOptions()
      .setHost(config.host())
      .setPort(config.port());
    return vertx.createHttpServer(options)
      .requestHandler(router())
      .listen()
      .onSuccess(started -> {
        server = started;
        LOG.info(() -> "Biowiki serving " + webs.root() + " on http://" + config.host() + ":" + started.actualPort());
      });
  }

  public Future<Void> stop() {
    if (server == null) {
      return Future.succeededFuture();
    }
    return server.close();
  }

  public int actualPort() {
    return server == null ? -1 : server.actualPort();
  }

  public WebCollection webs() {
    return webs;
  }
}
