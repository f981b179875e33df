package com.rolesync.verifier.reconcile.api;

import com.rolesync.verifier.reconcile.http.DiscordApiException;
import com.rolesync.verifier.reconcile.http.VerificationApiException;
import com.rolesync.verifier.reconcile.service.InvalidGuildConfigException;
import com.rolesync.verifier.reconcile.service.JobAlreadyRunningException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ReconcileExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ReconcileExceptionHandler.class);

  @ExceptionHandler(JobAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleJobRunning(JobAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "job_already_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidGuildConfigException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfig(InvalidGuildConfigException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "invalid_guild_config", "message", ex.getMessage()));
  }

  @ExceptionHandler({VerificationApiException.class, DiscordApiException.class})
  public ResponseEntity<Map<String, String>> handleUpstream(RuntimeException ex) {
    log.warn("Upstream call failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(Map.of("error", "upstream_unavailable", "message", ex.getMessage()));
  }
}
