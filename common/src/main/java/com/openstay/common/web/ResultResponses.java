package com.openstay.common.web;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.exception.ErrorCode;
import com.openstay.common.result.OperationResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.function.Function;

/**
 * Maps tagged operation results onto HTTP responses.
 */
public final class ResultResponses {

    private ResultResponses() {
        // Utility class
    }

    public static <T, R> ResponseEntity<BaseResponse<R>> toResponse(
            OperationResult<T> result, HttpStatus successStatus, Function<? super T, ? extends R> body) {
        if (result.isSuccess()) {
            return ResponseEntity.status(successStatus).body(BaseResponse.success(body.apply(result.getValue())));
        }
        ErrorCode error = result.getError().orElse(ErrorCode.INTERNAL_ERROR);
        return ResponseEntity.status(error.getStatus()).body(BaseResponse.error(error, result.getMessage()));
    }

    public static <T> ResponseEntity<BaseResponse<T>> ok(OperationResult<T> result) {
        return toResponse(result, HttpStatus.OK, Function.identity());
    }
}
