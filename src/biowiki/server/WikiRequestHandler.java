package biowiki.server;

import biowiki.router.PathRouter;
import biowiki.router.Route;
import biowiki.store.Attachment;
import biowiki.store.AttachmentException;
import biowiki.store.AttachmentStub;
import biowiki.store.AttachmentUpload;
import biowiki.store.Names;
import biowiki.store.Page;
import biowiki.store.PageDetail;
import biowiki.store.PageException;
import biowiki.store.PageStub;
import biowiki.store.VersionStub;
import biowiki.store.Web;
import biowiki.store.WebCollection;
import biowiki.store.WebException;
import biowiki.store.WebStub;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.shareddata.Lock;
import io.vertx.ext.web.RoutingContext;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a classified request against the {@link WebCollection}.
 *
 * <p>Store calls block, so they run on a worker thread while holding a shared-data local
 * lock: {@value #WEBS_LOCK} for collection routes and {@value #WEB_LOCK_PREFIX}{@code <web>}
 * for everything inside one web. Writers to the same web are serialized; different webs
 * proceed in parallel.
 */
final class WikiRequestHandler implements Handler<RoutingContext> {
  private static final Logger LOG = Logger.getLogger(WikiRequestHandler.class.getName());
  static final String WEBS_LOCK = "biowiki.webs";
  static final String WEB_LOCK_PREFIX = "biowiki.web:";

  private final Vertx vertx;
  private final WebCollection webs;
  private final PathRouter router;
  private final long lockTimeoutMillis;

  WikiRequestHandler(Vertx vertx, WebCollection webs, PathRouter router, long lockTimeoutMillis) {
    this.vertx = vertx;
    this.webs = webs;
    this.router = router;
    this.lockTimeoutMillis = lockTimeoutMillis;
  }

  @Override
  public void handle(RoutingContext ctx) {
    Route route = router.route(ctx.request().method(), ctx.request().path());
    LOG.fine(() -> ctx.request().method() + " " + ctx.request().path() + " -> " + route);
    if (!route.isValid()) {
      write(ctx, WikiResponse.error(404, "No route for " + ctx.request().method() + " " + ctx.request().path()));
      return;
    }
    Buffer body = ctx.body() == null ? null : ctx.body().buffer();
    String lockKey = lockKey(route);
    vertx.sharedData().getLocalLockWithTimeout(lockKey, lockTimeoutMillis).onComplete(lockAr -> {
      if (lockAr.failed()) {
        LOG.warning(() -> "Could not lock " + lockKey + ": " + lockAr.cause().getMessage());
        write(ctx, WikiResponse.error(503, "Store is busy"));
        return;
      }
      Lock lock = lockAr.result();
      vertx.executeBlocking(() -> dispatch(route, body), false).onComplete(ar -> {
        lock.release();
        if (ar.succeeded()) {
          write(ctx, ar.result());
        } else {
          LOG.log(Level.SEVERE, "Unexpected failure handling " + route, ar.cause());
          write(ctx, WikiResponse.error(500, ar.cause().getMessage()));
        }
      });
    });
  }

  static String lockKey(Route route) {
    switch (route.kind()) {
      case LIST_WEBS:
      case CREATE_WEB:
        return WEBS_LOCK;
      default:
        return WEB_LOCK_PREFIX + route.webName();
    }
  }

  WikiResponse dispatch(Route route, Buffer body) {
    try {
      switch (route.kind()) {
        case LIST_WEBS:
          return listWebs();
        case CREATE_WEB:
          return createWeb(body);
        case LIST_PAGES:
          return withWeb(route, this::listPages);
        case CREATE_PAGE:
          return withWeb(route, web -> createPage(web, body));
        case SHOW_PAGE:
          return withWeb(route, web -> showPage(web, route.pageName()));
        case UPDATE_PAGE:
          return withWeb(route, web -> updatePage(web, route.pageName(), body));
        case LIST_ATTACHMENTS:
          return withWeb(route, web -> listAttachments(web.openPage(route.pageName())));
        case CREATE_ATTACHMENT:
          return withWeb(route, web -> createAttachment(web.openPage(route.pageName()), body));
        case SERVE_ATTACHMENT:
          return withWeb(route, web -> serveAttachment(web.openPage(route.pageName()), route.attachmentName()));
        case LIST_PAGE_VERSIONS:
          return withWeb(route, web -> listVersions(web.openPage(route.pageName())));
        case SHOW_PAGE_VERSION:
          return withWeb(route, web -> WikiResponse.json(
            web.openPage(route.pageName()).getVersion(route.versionHash()).toJson()));
        default:
          return WikiResponse.error(404, "No route");
      }
    } catch (WebException e) {
      return failure(route, statusFor(e.kind()), e);
    } catch (PageException e) {
      return failure(route, statusFor(e.kind()), e);
    } catch (AttachmentException e) {
      return failure(route, statusFor(e.kind()), e);
    }
  }

  private WikiResponse listWebs() throws WebException {
    JsonArray array = new JsonArray();
    for (WebStub stub : webs.list()) {
      array.add(new JsonObject().put("name", stub.name()));
    }
    return WikiResponse.json(array);
  }

  private WikiResponse createWeb(Buffer body) throws WebException {
    JsonObject json = parseObject(body);
    Object name = json == null ? null : json.getValue("name");
    if (!(name instanceof String)) {
      return WikiResponse.error(400, "Expected {\"name\": string}");
    }
    webs.create((String) name);
    return WikiResponse.ok();
  }

  private WikiResponse listPages(Web web) throws PageException {
    JsonArray array = new JsonArray();
    for (PageStub stub : web.listPages()) {
      array.add(new JsonObject().put("name", stub.name()));
    }
    return WikiResponse.json(array);
  }

  private WikiResponse createPage(Web web, Buffer body) throws PageException {
    PageDetail detail;
    try {
      detail = PageDetail.parse(body);
    } catch (PageException e) {
      return WikiResponse.error(400, e.getMessage());
    }
    if (!Names.isPlainSegment(detail.name())) {
      return WikiResponse.error(400, "Invalid page name: " + detail.name());
    }
    web.newPage(detail).create();
    return WikiResponse.ok();
  }

  private WikiResponse showPage(Web web, String pageName) throws PageException {
    return WikiResponse.json(web.openPage(pageName).detail().toJson());
  }

  private WikiResponse updatePage(Web web, String pageName, Buffer body) throws PageException {
    PageDetail detail;
    try {
      detail = PageDetail.parse(body);
    } catch (PageException e) {
      return WikiResponse.error(400, e.getMessage());
    }
    if (!detail.name().equals(pageName)) {
      return WikiResponse.error(400, "Page name " + detail.name() + " does not match " + pageName);
    }
    web.newPage(detail).update();
    return WikiResponse.ok();
  }

  private WikiResponse listAttachments(Page page) throws AttachmentException {
    JsonArray array = new JsonArray();
    for (AttachmentStub stub : page.listAttachments()) {
      array.add(new JsonObject().put("file_name", stub.fileName()));
    }
    return WikiResponse.json(array);
  }

  private WikiResponse createAttachment(Page page, Buffer body) throws AttachmentException {
    AttachmentUpload upload;
    try {
      upload = AttachmentUpload.parse(body);
    } catch (AttachmentException e) {
      return WikiResponse.error(400, e.getMessage());
    }
    if (!upload.isFileNameValid()) {
      return WikiResponse.error(400, "Invalid attachment file name: " + upload.fileName());
    }
    page.saveAttachment(upload);
    LOG.info(() -> "Saved attachment " + upload.fileName() + " on " + page.directory());
    return WikiResponse.ok();
  }

  private WikiResponse serveAttachment(Page page, String fileName) throws AttachmentException {
    Attachment attachment = page.getAttachment(fileName);
    return WikiResponse.bytes(attachment.data(), attachment.mimeType().value());
  }

  private WikiResponse listVersions(Page page) throws PageException {
    JsonArray array = new JsonArray();
    List<VersionStub> versions = page.listVersions();
    for (VersionStub stub : versions) {
      array.add(new JsonObject().put("hash", stub.hash()));
    }
    return WikiResponse.json(array);
  }

  private WikiResponse withWeb(Route route, WebAction action)
    throws WebException, PageException, AttachmentException {
    Optional<Web> web = webs.get(route.webName());
    if (web.isEmpty()) {
      return WikiResponse.error(404, "No web " + route.webName());
    }
    return action.apply(web.get());
  }

  private static JsonObject parseObject(Buffer body) {
    if (body == null || body.length() == 0) {
      return null;
    }
    try {
      Object value = Json.decodeValue(body);
      return value instanceof JsonObject ? (JsonObject) value : null;
    } catch (DecodeException e) {
      return null;
    }
  }

  private static WikiResponse failure(Route route, int status, Exception e) {
    if (status >= 500) {
      LOG.log(Level.SEVERE, route + " failed", e);
    } else if (e instanceof PageException && ((PageException) e).kind() == PageException.Kind.NAME_MISMATCH) {
      LOG.warning(() -> route + ": " + e.getMessage());
    } else {
      LOG.fine(() -> route + " rejected: " + e.getMessage());
    }
    return WikiResponse.error(status, e.getMessage());
  }

  static int statusFor(WebException.Kind kind) {
    switch (kind) {
      case INVALID_NAME:
      case OVERWRITE:
        return 400;
      default:
        return 500;
    }
  }

  static int statusFor(PageException.Kind kind) {
    switch (kind) {
      case NOT_FOUND:
        return 404;
      case NAME_MISMATCH:
      case OVERWRITE:
      case INVALID_PATH:
        return 400;
      default:
        return 500;
    }
  }

  static int statusFor(AttachmentException.Kind kind) {
    switch (kind) {
      case NOT_FOUND:
        return 404;
      case DECODE:
        return 400;
      default:
        return 500;
    }
  }

  private static void write(RoutingContext ctx, WikiResponse response) {
    HttpServerResponse http = ctx.response();
    if (http.ended()) {
      return;
    }
    http.setStatusCode(response.status());
    if (response.contentType() != null) {
      http.putHeader("Content-Type", response.contentType());
    }
    http.end(response.body());
  }

  @FunctionalInterface
  private interface WebAction {
    WikiResponse apply(Web web) throws WebException, PageException, AttachmentException;
  }
}
