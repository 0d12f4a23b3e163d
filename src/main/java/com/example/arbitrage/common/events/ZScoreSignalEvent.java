package com.example.arbitrage.common.events;

import com.example.arbitrage.common.model.PairCorrelation;
import com.example.arbitrage.common.model.ZScoreSignal;
import lombok.*;

@Data
@Builder
@ToString
@AllArgsConstructor
@NoArgsConstructor
public class ZScoreSignalEvent {
    private ZScoreSignal signal;
    private PairCorrelation correlation;
}
