package biowiki.router;

import io.vertx.core.http.HttpMethod;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

public class PathRouterTest {
  private final PathRouter router = PathRouter.wiki();

  @Test
  public void classifiesReadRoutes() {
    assertThat(router.route(HttpMethod.GET, "/webs").kind(), is(Route.Kind.LIST_WEBS));
    assertThat(router.route(HttpMethod.GET, "/webs/Home/pages").kind(), is(Route.Kind.LIST_PAGES));
    assertThat(router.route(HttpMethod.GET, "/webs/Home/pages/WebHome/attachments").kind(),
      is(Route.Kind.LIST_ATTACHMENTS));
    assertThat(router.route(HttpMethod.GET, "/webs/Home/pages/WebHome/versions").kind(),
      is(Route.Kind.LIST_PAGE_VERSIONS));
  }

  @Test
  public void showPageCarriesWebAndPageNames() {
    Route route = router.route(HttpMethod.GET, "/webs/alpha/pages/beta");

    assertThat(route.kind(), is(Route.Kind.SHOW_PAGE));
    assertThat(route.webName(), is("alpha"));
    assertThat(route.pageName(), is("beta"));
    assertThat(route.attachmentName(), is(nullValue()));
  }

  @Test
  public void attachmentNameRouteIsPreferredOverListing() {
    Route route = router.route(HttpMethod.GET, "/webs/alpha/pages/beta/attachments/photo.png");

    assertThat(route.kind(), is(Route.Kind.SERVE_ATTACHMENT));
    assertThat(route.attachmentName(), is("photo.png"));
  }

  @Test
  public void versionRouteCarriesHash() {
    Route route = router.route(HttpMethod.GET, "/webs/alpha/pages/beta/versions/abc123");

    assertThat(route.kind(), is(Route.Kind.SHOW_PAGE_VERSION));
    assertThat(route.versionHash(), is("abc123"));
  }

  @Test
  public void classifiesWriteRoutes() {
    assertThat(router.route(HttpMethod.POST, "/webs").kind(), is(Route.Kind.CREATE_WEB));
    assertThat(router.route(HttpMethod.POST, "/webs/Home/pages").kind(), is(Route.Kind.CREATE_PAGE));
    assertThat(router.route(HttpMethod.POST, "/webs/Home/pages/WebHome/attachments").kind(),
      is(Route.Kind.CREATE_ATTACHMENT));
    assertThat(router.route(HttpMethod.PUT, "/webs/Home/pages/WebHome").kind(), is(Route.Kind.UPDATE_PAGE));
  }

  @Test
  public void unmatchedRequestsAreInvalid() {
    assertThat(router.route(HttpMethod.GET, "/webs/alpha").kind(), is(Route.Kind.INVALID));
    assertThat(router.route(HttpMethod.GET, "/").kind(), is(Route.Kind.INVALID));
    assertThat(router.route(HttpMethod.PUT, "/webs").kind(), is(Route.Kind.INVALID));
    assertThat(router.route(HttpMethod.POST, "/webs/Home/pages/WebHome").kind(), is(Route.Kind.INVALID));
    assertThat(router.route(HttpMethod.DELETE, "/webs/Home/pages/WebHome").kind(), is(Route.Kind.INVALID));
    assertThat(router.route(HttpMethod.POST, "/webs/Home/pages/WebHome/attachments/a.png").kind(),
      is(Route.Kind.INVALID));
  }

  @Test
  public void firstRegisteredRuleWins() {
    PathRouter custom = PathRouter.builder()
      .add(HttpMethod.GET, "/webs/:web_name", Route.Kind.LIST_PAGES)
      .add(HttpMethod.GET, "/webs/Home", Route.Kind.LIST_WEBS)
      .build();

    assertThat(custom.route(HttpMethod.GET, "/webs/Home").kind(), is(Route.Kind.LIST_PAGES));
  }
}
