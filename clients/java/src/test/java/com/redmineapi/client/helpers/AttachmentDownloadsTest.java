package com.redmineapi.client.helpers;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableMap;
import com.redmineapi.client.RecordingTransport;
import com.redmineapi.client.Redmine;
import com.redmineapi.client.RedmineFixtures;
import com.redmineapi.client.resources.Resource;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AttachmentDownloadsTest {

  @TempDir
  Path directory;

  @Test
  void testDownloadUsesContentUrl() {
    RecordingTransport transport = new RecordingTransport();
    Redmine redmine = RedmineFixtures.create(transport);
    Resource attachment = redmine.manager("Attachment").toResource(ImmutableMap.of(
        "id", 3,
        "filename", "log.txt",
        "content_url", RedmineFixtures.URL + "/attachments/download/3/log.txt"));

    Path saved = AttachmentDownloads.download(attachment, directory, "copy.txt");

    assertEquals(directory.resolve("copy.txt"), saved);
    assertEquals(RedmineFixtures.URL + "/attachments/download/3/log.txt",
        transport.downloads().get(0));
  }

  @Test
  void testOnlyAttachmentsCanBeDownloaded() {
    Redmine redmine = RedmineFixtures.create(new RecordingTransport());
    Resource issue = redmine.issues().toResource(ImmutableMap.of("id", 1));

    assertThrows(IllegalArgumentException.class,
        () -> AttachmentDownloads.download(issue, directory, null));
  }
}
