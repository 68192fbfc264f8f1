package com.tradejournal.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DeleteSourceResponse {

    private final String account;
    private final int deletedCount;
}
