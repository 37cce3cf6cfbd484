package biowiki.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MimeTypeTest {
  @Test
  void knownExtensions() {
    assertEquals(MimeType.PNG, MimeType.forFileName("photo.png"));
    assertEquals(MimeType.JPEG, MimeType.forFileName("photo.jpg"));
    assertEquals(MimeType.JPEG, MimeType.forFileName("photo.JPEG"));
    assertEquals("image/png", MimeType.forFileName("a.b.PNG").value());
  }

  @Test
  void everythingElseIsOctetStream() {
    assertEquals(MimeType.OCTET_STREAM, MimeType.forFileName("notes.txt"));
    assertEquals(MimeType.OCTET_STREAM, MimeType.forFileName("noext"));
    assertEquals(MimeType.OCTET_STREAM, MimeType.forFileName(".png"));
    assertEquals(MimeType.OCTET_STREAM, MimeType.forFileName("photo."));
    assertEquals("application/octet-stream", MimeType.OCTET_STREAM.value());
  }
}
