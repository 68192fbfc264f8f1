package com.tradejournal.api.controller;

import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.service.OwnerResolver;
import com.tradejournal.service.TradeRecordService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for reading imported trades.
 */
@RestController
@RequestMapping("/api/trades")
public class TradeRecordController {

    private final TradeRecordService tradeRecordService;
    private final OwnerResolver ownerResolver;

    public TradeRecordController(TradeRecordService tradeRecordService, OwnerResolver ownerResolver) {
        this.tradeRecordService = tradeRecordService;
        this.ownerResolver = ownerResolver;
    }

    @GetMapping
    public List<TradeRecord> getTrades(
            @RequestHeader(value = OwnerResolver.OWNER_HEADER, required = false) String ownerId,
            @RequestParam(required = false) String account,
            @RequestParam(required = false) String side,
            @RequestParam(defaultValue = "false") boolean hideFilledZeroPnl) {
        return tradeRecordService.listTrades(ownerResolver.resolve(ownerId), account, side, hideFilledZeroPnl);
    }
}
