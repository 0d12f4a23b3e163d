package com.example.arbitrage.common.model;

import java.time.Instant;

public record PricePoint(Instant timestamp, double price) {
}
