package com.example.arbitrage.core.services;

import com.example.arbitrage.common.events.ArbitrageOpportunityEvent;
import com.example.arbitrage.common.events.PathProfitEvent;
import com.example.arbitrage.common.events.ZScoreSignalEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Отдает найденные возможности слою исполнения через события Spring
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArbitrageEventPublisher {
    private final ApplicationEventPublisher applicationEventPublisher;

    public void publishPathProfit(PathProfitEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    public void publishOpportunity(ArbitrageOpportunityEvent event) {
        applicationEventPublisher.publishEvent(event);
    }

    public void publishSignal(ZScoreSignalEvent event) {
        applicationEventPublisher.publishEvent(event);
    }
}
