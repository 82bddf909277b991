package com.fintech.checkout.controller;

import com.fintech.checkout.dto.ApiResult;
import com.fintech.checkout.dto.CreateOrderRequest;
import com.fintech.checkout.dto.UpdateOrderStatusRequest;
import com.fintech.checkout.entity.Order;
import com.fintech.checkout.entity.OrderStatus;
import com.fintech.checkout.exception.InvalidPaymentRequestException;
import com.fintech.checkout.service.OrderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;

@RestController
@RequiredArgsConstructor
@Tag(name = "Orders", description = "Order placement, lookup and fulfillment status")
public class OrderController {

    private static final int MAX_PAGE_SIZE = 100;

    private final OrderService orderService;

    @Operation(summary = "Place order", description = "Stores a pending order; totals are computed from the items.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order placed"),
            @ApiResponse(responseCode = "400", description = "Invalid items")
    })
    @PostMapping("/api/orders")
    public ResponseEntity<ApiResult<Order>> create(@Valid @RequestBody CreateOrderRequest request) {
        Order order = orderService.createOrder(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResult.ok(order, "Order placed"));
    }

    @Operation(summary = "Get order", description = "Returns the order with its payment summary.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/api/orders/{id}")
    public ResponseEntity<ApiResult<Order>> get(@PathVariable String id) {
        return ResponseEntity.ok(ApiResult.ok(orderService.getOrder(id)));
    }

    @Operation(summary = "Cancel order", description = "Customer cancellation of an unpaid pending order.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order cancelled"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order is paid or already in fulfillment")
    })
    @PostMapping("/api/orders/{id}/cancel")
    public ResponseEntity<ApiResult<Order>> cancel(@PathVariable String id) {
        return ResponseEntity.ok(ApiResult.ok(orderService.cancelOrder(id), "Order cancelled"));
    }

    @Operation(summary = "List orders", description = "Newest first, optionally filtered by status.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Page of orders"),
            @ApiResponse(responseCode = "400", description = "Unknown status")
    })
    @GetMapping("/api/admin/orders")
    public ResponseEntity<ApiResult<Page<Order>>> list(
            @Parameter(description = "pending, confirmed, delivered, cancelled or all") @RequestParam(required = false) String status,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        return ResponseEntity.ok(ApiResult.ok(orderService.listOrders(parseStatus(status), pageable)));
    }

    @Operation(summary = "Change order status")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "400", description = "Status missing or unknown"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Transition not allowed")
    })
    @PatchMapping("/api/admin/orders/{id}/status")
    public ResponseEntity<ApiResult<Order>> updateStatus(@PathVariable String id,
                                                         @Valid @RequestBody UpdateOrderStatusRequest request) {
        Order order = orderService.updateStatus(id, request.getStatus());
        return ResponseEntity.ok(ApiResult.ok(order, "Order status updated"));
    }

    private static OrderStatus parseStatus(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return null;
        }
        return Arrays.stream(OrderStatus.values())
                .filter(status -> status.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidPaymentRequestException("Unknown order status: " + value));
    }
}
