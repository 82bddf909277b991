package com.fintech.checkout.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Order placed from the storefront cart. Totals are computed server side from the items.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    @Size(max = 64)
    private String userId;

    @NotEmpty
    @Size(max = 100)
    @Valid
    private List<Item> items;

    @PositiveOrZero
    @Digits(integer = 12, fraction = 2)
    private BigDecimal tax;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {

        @NotBlank
        @Size(max = 64)
        private String productId;

        @Size(max = 200)
        private String name;

        @NotNull
        @Min(1)
        @Max(10000)
        private Integer quantity;

        @NotNull
        @DecimalMin("0.01")
        @Digits(integer = 10, fraction = 2)
        private BigDecimal unitPrice;
    }
}
