package com.tradejournal.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tradejournal.api.controller.TradeRecordController;
import com.tradejournal.config.ApiResponseAdvice;
import com.tradejournal.config.ImportConfig;
import com.tradejournal.domain.model.TradeRecord;
import com.tradejournal.service.OwnerResolver;
import com.tradejournal.service.TradeRecordService;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TradeRecordControllerTest {

    private MockMvc mockMvc;

    @Mock
    private TradeRecordService tradeRecordService;

    @BeforeEach
    void setUp() {
        ImportConfig importConfig = new ImportConfig();
        importConfig.setDefaultOwner("desk");
        OwnerResolver ownerResolver = new OwnerResolver(importConfig);
        mockMvc = MockMvcBuilders.standaloneSetup(new TradeRecordController(tradeRecordService, ownerResolver))
                .setControllerAdvice(new ApiResponseAdvice(ownerResolver))
                .build();
    }

    @Test
    @DisplayName("GET /api/trades forwards filters and the default owner")
    void listTrades() throws Exception {
        TradeRecord trade = TradeRecord.builder()
                .id("t-1")
                .ticker("NQ")
                .side("Long")
                .pnl(new BigDecimal("196.0000"))
                .sourceAccount("Apex")
                .build();
        when(tradeRecordService.listTrades("desk", "Apex", null, true)).thenReturn(List.of(trade));

        mockMvc.perform(get("/api/trades").param("account", "Apex").param("hideFilledZeroPnl", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value("desk"))
                .andExpect(jsonPath("$.data[0].id").value("t-1"))
                .andExpect(jsonPath("$.data[0].ticker").value("NQ"))
                .andExpect(jsonPath("$.data[0].pnl").value(196.0));
    }
}
