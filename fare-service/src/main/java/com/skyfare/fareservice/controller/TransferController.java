package com.skyfare.fareservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.TransferClient;
import com.skyfare.fareservice.client.dto.TransferSearchRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Tag(name = "Transfers", description = "Airport and city transfer offers")
public class TransferController {

	private final TransferClient transferClient;

	@PostMapping("/offers")
	@Operation(
		summary = "Search transfer offers",
		description = "Pickup and drop-off are each given by location code, address or geo code."
	)
	public ResponseEntity<JsonNode> searchOffers(@Valid @RequestBody TransferSearchRequest request) {
		return ResponseEntity.ok(transferClient.search(request));
	}
}
