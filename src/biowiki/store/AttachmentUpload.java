package biowiki.store;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * An attachment as submitted by a client: a file name and base64-encoded bytes.
 */
public final class AttachmentUpload {
  static final String FILE_NAME = "file_name";
  static final String ENCODED_DATA = "encoded_data";

  // word characters only on both sides of the dot
  private static final Pattern UPLOAD_NAME = Pattern.compile("^\\w+\\.\\w+$");

  private final String fileName;
  private final String encodedData;

  public AttachmentUpload(String fileName, String encodedData) {
    this.fileName = fileName;
    this.encodedData = encodedData;
  }

  public static AttachmentUpload parse(Buffer data) throws AttachmentException {
    if (data == null || data.length() == 0) {
      throw new AttachmentException(AttachmentException.Kind.SERIALIZATION, "Attachment payload is empty");
    }
    Object value;
    try {
      value = Json.decodeValue(data);
    } catch (DecodeException e) {
      throw new AttachmentException(AttachmentException.Kind.SERIALIZATION, "Attachment payload is not valid JSON", e);
    }
    if (!(value instanceof JsonObject)) {
      throw new AttachmentException(AttachmentException.Kind.SERIALIZATION, "Attachment payload is not a JSON object");
    }
    JsonObject json = (JsonObject) value;
    Object fileName = json.getValue(FILE_NAME);
    Object encodedData = json.getValue(ENCODED_DATA);
    if (!(fileName instanceof String) || !(encodedData instanceof String)) {
      throw new AttachmentException(AttachmentException.Kind.SERIALIZATION,
        "Attachment payload requires string " + FILE_NAME + " and " + ENCODED_DATA);
    }
    return new AttachmentUpload((String) fileName, (String) encodedData);
  }

  /**
   * Whether the submitted name is acceptable for a new attachment. Stricter than
   * {@link Attachment#isStoredNameValid(String)}; checked by callers before saving.
   */
  public boolean isFileNameValid() {
    return fileName != null && UPLOAD_NAME.matcher(fileName).matches();
  }

  public Buffer decode() throws AttachmentException {
    try {
      return Buffer.buffer(Base64.getDecoder().decode(encodedData));
    } catch (IllegalArgumentException e) {
      throw new AttachmentException(AttachmentException.Kind.DECODE, "Attachment data is not valid base64", e);
    }
  }

  public String fileName() {
    return fileName;
  }
}
