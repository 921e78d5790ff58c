package com.openstay.stay.visit.api.controller;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.web.ResultResponses;
import com.openstay.stay.visit.api.dto.VisitRequestCreateRequest;
import com.openstay.stay.visit.api.dto.VisitRequestResponse;
import com.openstay.stay.visit.domain.service.VisitRequestRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/visit-request")
@RequiredArgsConstructor
public class VisitRequestController {

    private final VisitRequestRegistry registry;

    @PostMapping
    public ResponseEntity<BaseResponse<VisitRequestResponse>> requestVisit(
            @Valid @RequestBody VisitRequestCreateRequest request) {
        return ResultResponses.toResponse(
                registry.requestVisit(request.userEmail(), request.userName(), request.listingId(),
                        request.ownerEmail(), request.visitDate(), request.visitTime()),
                HttpStatus.CREATED, VisitRequestResponse::from);
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<BaseResponse<VisitRequestResponse>> approve(@PathVariable Long id) {
        return ResultResponses.toResponse(registry.approve(id), HttpStatus.OK, VisitRequestResponse::from);
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<BaseResponse<VisitRequestResponse>> reject(@PathVariable Long id) {
        return ResultResponses.toResponse(registry.reject(id), HttpStatus.OK, VisitRequestResponse::from);
    }

    @GetMapping("/user/{email}")
    public ResponseEntity<BaseResponse<List<VisitRequestResponse>>> forUser(@PathVariable String email) {
        return ResultResponses.toResponse(registry.requestsForUser(email), HttpStatus.OK,
                requests -> requests.stream().map(VisitRequestResponse::from).toList());
    }

    @GetMapping("/listing/{listingId}")
    public ResponseEntity<BaseResponse<List<VisitRequestResponse>>> forListing(@PathVariable Long listingId) {
        return ResultResponses.toResponse(registry.requestsForListing(listingId), HttpStatus.OK,
                requests -> requests.stream().map(VisitRequestResponse::from).toList());
    }
}
