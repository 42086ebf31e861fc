package com.ragguard.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

class S3ObjectStoreTest {

    private S3Client s3Client;
    private S3ObjectStore store;

    @BeforeEach
    void setUp() {
        s3Client = mock(S3Client.class);
        store = new S3ObjectStore(s3Client);
        ReflectionTestUtils.setField(store, "bucket", "ragguard-docs");
    }

    @Test
    void shouldReadObjectBytesFromBucket() throws IOException {
        byte[] content = "%PDF-1.7".getBytes(StandardCharsets.US_ASCII);
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), content));

        assertThat(store.get("input/report.pdf")).isEqualTo(content);

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("ragguard-docs");
        assertThat(captor.getValue().key()).isEqualTo("input/report.pdf");
    }

    @Test
    void shouldWriteContentTypeAndMetadata() throws IOException {
        store.put("synced-content/a.txt", new byte[]{1, 2}, "text/plain", Map.of("classification", "public"));

        ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
        assertThat(captor.getValue().contentType()).isEqualTo("text/plain");
        assertThat(captor.getValue().metadata()).containsEntry("classification", "public");
    }

    @Test
    void shouldDeleteByKey() throws IOException {
        store.delete("input/memo.pdf");

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(captor.capture());
        assertThat(captor.getValue().key()).isEqualTo("input/memo.pdf");
    }

    @Test
    void shouldWrapSdkFailuresAsIoException() {
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("The specified key does not exist.").build());

        assertThatThrownBy(() -> store.get("input/missing.pdf"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("s3://ragguard-docs/input/missing.pdf");
    }
}
