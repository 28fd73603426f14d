package com.weiwo.bridge.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weiwo.bridge.config.ApplicationProperties;
import com.weiwo.bridge.exception.ExternalApiException;
import com.weiwo.bridge.exception.KnowledgeNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientKnowledgeApiClientTest {

    @TempDir
    Path tempDir;

    private final List<ClientRequest> requests = new ArrayList<>();
    private ApplicationProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ApplicationProperties();
        properties.getApi().setBaseUrl("http://knowledge.test/api/v1");
    }

    @Test
    void uploadPostsMultipartToKnowledgeBase() throws IOException {
        Path file = Files.writeString(tempDir.resolve("ABC123.pdf"), "pdf body");
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.OK,
                "{\"success\":true,\"data\":{\"id\":\"k1\",\"parse_status\":\"pending\",\"file_path\":\"/store/k1.pdf\"}}");

        StepVerifier.create(client.uploadFile("kb-1", file, "扫描件.pdf"))
                .assertNext(info -> {
                    assertThat(info.id()).isEqualTo("k1");
                    assertThat(info.parseStatus()).isEqualTo("pending");
                    assertThat(info.filePath()).isEqualTo("/store/k1.pdf");
                })
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/api/v1/knowledge-bases/kb-1/knowledge/file");
        assertThat(request.headers().getContentType()).isNotNull();
        assertThat(request.headers().getContentType().isCompatibleWith(MediaType.MULTIPART_FORM_DATA)).isTrue();
    }

    @Test
    void uploadWithoutKnowledgeIdIsAnError() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.pdf"), "pdf body");
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.OK,
                "{\"success\":true,\"data\":{\"parse_status\":\"pending\"}}");

        StepVerifier.create(client.uploadFile("kb-1", file, "a.pdf"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ExternalApiException.class);
                    assertThat(((ExternalApiException) error).getStatusCode()).isEqualTo(200);
                })
                .verify();
    }

    @Test
    void getKnowledgeReadsParseStatus() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.OK,
                "{\"success\":true,\"data\":{\"id\":\"k1\",\"parse_status\":\"failed\",\"error_message\":\"ocr timeout\",\"extra\":1}}");

        StepVerifier.create(client.getKnowledge("k1"))
                .assertNext(info -> {
                    assertThat(info.parseStatus()).isEqualTo("failed");
                    assertThat(info.errorMessage()).isEqualTo("ocr timeout");
                })
                .verifyComplete();

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.GET);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/v1/knowledge/k1");
    }

    @Test
    void getKnowledgeNotFoundIsTyped() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.NOT_FOUND, "{\"message\":\"not found\"}");

        StepVerifier.create(client.getKnowledge("k1"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(KnowledgeNotFoundException.class);
                    assertThat(((KnowledgeNotFoundException) error).getKnowledgeId()).isEqualTo("k1");
                })
                .verify();
    }

    @Test
    void serverErrorKeepsStatusAndRemoteMessage() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.SERVICE_UNAVAILABLE,
                "{\"success\":false,\"message\":\"parser overloaded\"}");

        StepVerifier.create(client.getKnowledge("k1"))
                .expectErrorSatisfies(error -> {
                    ExternalApiException apiError = (ExternalApiException) error;
                    assertThat(apiError.getStatusCode()).isEqualTo(503);
                    assertThat(apiError.getRemoteMessage()).isEqualTo("parser overloaded");
                    assertThat(apiError.isTransient()).isTrue();
                })
                .verify();
    }

    @Test
    void unsuccessfulEnvelopeIsAnError() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.OK,
                "{\"success\":false,\"code\":400,\"msg\":\"knowledge id malformed\"}");

        StepVerifier.create(client.getKnowledge("bad id"))
                .expectErrorSatisfies(error -> {
                    ExternalApiException apiError = (ExternalApiException) error;
                    assertThat(apiError.getStatusCode()).isEqualTo(200);
                    assertThat(apiError.getRemoteMessage()).isEqualTo("knowledge id malformed");
                    assertThat(apiError.isTransient()).isFalse();
                })
                .verify();
    }

    @Test
    void envelopeWithoutSuccessFlagIsSuccessful() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.OK,
                "{\"data\":{\"id\":\"k1\",\"parse_status\":\"completed\"}}");

        StepVerifier.create(client.getKnowledge("k1"))
                .assertNext(info -> assertThat(info.parseStatus()).isEqualTo("completed"))
                .verifyComplete();
    }

    @Test
    void deleteTreatsNotFoundAsDone() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.NOT_FOUND, "");

        StepVerifier.create(client.deleteKnowledge("k1")).verifyComplete();

        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.DELETE);
    }

    @Test
    void deleteServerErrorPropagates() {
        WebClientKnowledgeApiClient client = clientReturning(HttpStatus.INTERNAL_SERVER_ERROR, "boom");

        StepVerifier.create(client.deleteKnowledge("k1"))
                .expectErrorSatisfies(error -> {
                    ExternalApiException apiError = (ExternalApiException) error;
                    assertThat(apiError.getStatusCode()).isEqualTo(500);
                    assertThat(apiError.getRemoteMessage()).isEqualTo("500 boom");
                })
                .verify();
    }

    @Test
    void connectionFailureHasNoStatus() {
        WebClient webClient = WebClient.builder()
                .baseUrl(properties.getApi().getBaseUrl())
                .exchangeFunction(request -> Mono.error(new ConnectException("Connection refused")))
                .build();
        WebClientKnowledgeApiClient client = new WebClientKnowledgeApiClient(webClient, properties, new ObjectMapper());

        StepVerifier.create(client.getKnowledge("k1"))
                .expectErrorSatisfies(error -> {
                    ExternalApiException apiError = (ExternalApiException) error;
                    assertThat(apiError.getStatusCode()).isZero();
                    assertThat(apiError.isTransient()).isTrue();
                })
                .verify();
    }

    private WebClientKnowledgeApiClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl(properties.getApi().getBaseUrl())
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WebClientKnowledgeApiClient(webClient, properties, new ObjectMapper());
    }
}
