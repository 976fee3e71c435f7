package com.redmineapi.client.helpers;

import com.google.common.base.Preconditions;
import com.redmineapi.client.resources.Resource;
import java.nio.file.Path;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Saves the content of attachments to disk. */
public final class AttachmentDownloads {

  private AttachmentDownloads() {
    // Utility class, no instances
  }

  /**
   * Downloads an attachment's content.
   *
   * @param attachment An Attachment resource
   * @param directory The directory to save into
   * @param filename The file name, or null to use the name from the content URL
   * @return The path of the saved file
   */
  public static Path download(
      @Nonnull Resource attachment, @Nonnull Path directory, @Nullable String filename) {
    Preconditions.checkArgument(
        "Attachment".equals(attachment.type().name()),
        "Only attachments can be downloaded, got %s", attachment.type().name());
    String contentUrl = String.valueOf(attachment.get("content_url"));
    return attachment.redmine().download(contentUrl, directory, filename);
  }
}
