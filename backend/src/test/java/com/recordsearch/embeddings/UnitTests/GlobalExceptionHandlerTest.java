package com.recordsearch.embeddings.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.context.request.WebRequest;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Unit Tests")
public class GlobalExceptionHandlerTest {

  @Mock private WebRequest webRequest;

  @Mock private BindingResult bindingResult;

  @InjectMocks private GlobalExceptionHandler exceptionHandler;

  @BeforeEach
  void setUp() {
    ReflectionTestUtils.setField(exceptionHandler, "environment", "test");
    ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", false);
    when(webRequest.getDescription(false)).thenReturn("uri=/api/embeddings/find-similar");
  }

  @Nested
  @DisplayName("Status mapping")
  class StatusMappingTests {

    @Test
    @DisplayName("Should map invalid arguments to 400")
    void shouldMapIllegalArgumentToBadRequest() {
      // When
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleIllegalArgumentException(
              new IllegalArgumentException("either text or recordId must be provided"),
              webRequest);

      // Then
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getStatus()).isEqualTo(400);
      assertThat(response.getBody().getMessage())
          .isEqualTo("either text or recordId must be provided");
      assertThat(response.getBody().getPath()).isEqualTo("/api/embeddings/find-similar");
      assertThat(response.getBody().getTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("Should map missing resources to 404")
    void shouldMapNotFound() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleResourceNotFoundException(
              new ResourceNotFoundException("dataset not found: nope"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
      assertThat(response.getBody().getMessage()).isEqualTo("dataset not found: nope");
    }

    @Test
    @DisplayName("Should map disabled AI features to 412")
    void shouldMapConfigurationToPreconditionFailed() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleConfigurationException(
              new EmbeddingConfigurationException("AI features are not enabled"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PRECONDITION_FAILED);
      assertThat(response.getBody().getError()).isEqualTo("Precondition Failed");
    }

    @Test
    @DisplayName("Should map provider failures to 502")
    void shouldMapProviderFailureToBadGateway() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleProviderException(
              new EmbeddingProviderException("OpenAI API error (status 429): slow down"),
              webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
      assertThat(response.getBody().getMessage()).contains("429");
    }

    @Test
    @DisplayName("Should map undecodable stored vectors to 422")
    void shouldMapDecodeFailureToUnprocessable() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleVectorDecodeException(
              new VectorDecodeException("failed to parse existing embedding for record r1: bad"),
              webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    @DisplayName("Should name the missing query parameter")
    void shouldNameMissingParameter() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleMissingParameter(
              new MissingServletRequestParameterException("datasetId", "String"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getMessage())
          .isEqualTo("'datasetId' query parameter is required");
    }
  }

  @Nested
  @DisplayName("Validation errors")
  class ValidationTests {

    @Test
    @DisplayName("Should collect field errors")
    void shouldCollectFieldErrors() throws Exception {
      // Given
      when(bindingResult.getAllErrors())
          .thenReturn(
              List.of(
                  new FieldError("request", "datasetId", "datasetId is required"),
                  new FieldError("request", "limit", "limit must be at most 100")));
      MethodParameter parameter =
          new MethodParameter(Object.class.getMethod("equals", Object.class), 0);
      MethodArgumentNotValidException exception =
          new MethodArgumentNotValidException(parameter, bindingResult);

      // When
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleValidationExceptions(exception, webRequest);

      // Then
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
      assertThat(response.getBody().getError()).isEqualTo("Validation Failed");
      assertThat(response.getBody().getValidationErrors())
          .containsEntry("datasetId", "datasetId is required")
          .containsEntry("limit", "limit must be at most 100");
    }
  }

  @Nested
  @DisplayName("Unexpected errors")
  class UnexpectedErrorTests {

    @Test
    @DisplayName("Should hide the cause unless debug is enabled")
    void shouldHideCauseByDefault() {
      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new IllegalStateException("boom"), webRequest);

      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
      assertThat(response.getBody().getMessage()).isEqualTo("An unexpected error occurred");
      assertThat(response.getBody().getDebugMessage()).isNull();
    }

    @Test
    @DisplayName("Should include the cause when debug is enabled outside production")
    void shouldIncludeCauseInDebug() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new IllegalStateException("boom"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Should never include the cause in production")
    void shouldNotIncludeCauseInProduction() {
      ReflectionTestUtils.setField(exceptionHandler, "debugEnabled", true);
      ReflectionTestUtils.setField(exceptionHandler, "environment", "production");

      ResponseEntity<GlobalExceptionHandler.ErrorResponse> response =
          exceptionHandler.handleGlobalException(new IllegalStateException("boom"), webRequest);

      assertThat(response.getBody().getDebugMessage()).isNull();
    }
  }
}
