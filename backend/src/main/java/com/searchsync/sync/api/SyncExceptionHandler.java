package com.searchsync.sync.api;

import com.searchsync.sync.model.SyncErrorResponse;
import com.searchsync.sync.service.SyncFailedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {

  @ExceptionHandler(SyncFailedException.class)
  public ResponseEntity<SyncErrorResponse> handleSyncFailure(SyncFailedException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(SyncErrorResponse.of(ex.getMessage(), ex.getInserted(), ex.getUpdated()));
  }
}
