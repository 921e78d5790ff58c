package com.openstay.stay.inventory.api.controller;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.result.OperationResult;
import com.openstay.common.result.Operations;
import com.openstay.common.web.ResultResponses;
import com.openstay.stay.inventory.domain.service.InventoryStore;
import com.openstay.stay.listing.domain.model.RoomType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of a listing's room capacity. Mutation only happens through bookings.
 */
@RestController
@RequestMapping("/listing")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryStore inventoryStore;

    @GetMapping("/{listingId}/rooms")
    public ResponseEntity<BaseResponse<List<RoomType>>> getRooms(@PathVariable Long listingId) {
        OperationResult<List<RoomType>> result = Operations.capture("rooms", () -> inventoryStore.rooms(listingId));
        return ResultResponses.ok(result);
    }
}
