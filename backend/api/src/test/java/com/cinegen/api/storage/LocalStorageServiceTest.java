package com.cinegen.api.storage;

import com.cinegen.common.exception.ApiException;
import com.cinegen.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageServiceTest {

    @TempDir
    Path root;

    @Test
    void storesUnderRootAndReadsBack() {
        LocalStorageService storage = new LocalStorageService(root.toString());
        byte[] video = "mp4-bytes".getBytes(StandardCharsets.UTF_8);

        String ref = storage.put(video, "videos/veo/op1.mp4", "video/mp4");

        assertThat(Path.of(ref)).startsWith(root.toAbsolutePath().normalize()).exists();
        assertThat(storage.get(ref)).isEqualTo(video);
        assertThat(storage.get("videos/veo/op1.mp4")).isEqualTo(video);
    }

    @Test
    void overwritesSameName() throws Exception {
        LocalStorageService storage = new LocalStorageService(root.toString());

        storage.put(new byte[]{1}, "videos/sora/v1.mp4", "video/mp4");
        String ref = storage.put(new byte[]{2, 3}, "videos/sora/v1.mp4", "video/mp4");

        assertThat(Files.readAllBytes(Path.of(ref))).containsExactly(2, 3);
    }

    @Test
    void rejectsPathsOutsideRoot() {
        LocalStorageService storage = new LocalStorageService(root.toString());

        assertThatThrownBy(() -> storage.put(new byte[]{1}, "../escape.mp4", "video/mp4"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.STORAGE_FAILED);
    }

    @Test
    void missingFileIsStorageFailure() {
        LocalStorageService storage = new LocalStorageService(root.toString());

        assertThatThrownBy(() -> storage.get("videos/none.mp4"))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("File not found");
    }
}
