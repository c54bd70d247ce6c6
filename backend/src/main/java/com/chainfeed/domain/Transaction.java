package com.chainfeed.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * Categorized smart-contract transaction.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Getter
@Setter
@EqualsAndHashCode
public class Transaction {

    private String networkId;
    private String address;
    private long blockNumber;
    /** Unix seconds. Drives the per-topic checkpoint. */
    private long blockTimestamp;
    private String txid;
    private int txIndex;
    private String txFrom;
    private String method;
    @Builder.Default
    private Map<String, Object> args = new HashMap<>();
    private BigDecimal value;
}
