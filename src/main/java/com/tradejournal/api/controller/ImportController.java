package com.tradejournal.api.controller;

import com.tradejournal.api.dto.request.ImportStatementRequest;
import com.tradejournal.api.dto.response.DeleteSourceResponse;
import com.tradejournal.domain.model.ImportCommand;
import com.tradejournal.domain.model.ImportResult;
import com.tradejournal.domain.model.ImportSource;
import com.tradejournal.exception.ValidationException;
import com.tradejournal.service.ImportSourceService;
import com.tradejournal.service.OwnerResolver;
import com.tradejournal.service.StatementImportService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for statement imports.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/imports} -- upload a CSV statement (multipart)</li>
 *   <li>{@code GET /api/imports/sources} -- accounts and brokers imported so far</li>
 *   <li>{@code DELETE /api/imports/sources/{account}} -- remove every trade of an account</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/imports")
public class ImportController {

    private final StatementImportService statementImportService;
    private final ImportSourceService importSourceService;
    private final OwnerResolver ownerResolver;

    public ImportController(
            StatementImportService statementImportService,
            ImportSourceService importSourceService,
            OwnerResolver ownerResolver) {
        this.statementImportService = statementImportService;
        this.importSourceService = importSourceService;
        this.ownerResolver = ownerResolver;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ImportResult importStatement(
            @RequestHeader(value = OwnerResolver.OWNER_HEADER, required = false) String ownerId,
            @Valid @ModelAttribute ImportStatementRequest request) {
        ImportCommand command = ImportCommand.builder()
                .ownerId(ownerResolver.resolve(ownerId))
                .brokerName(request.getBroker())
                .accountName(request.getAccount())
                .statementText(readStatement(request))
                .feePerContract(request.getFeePerContract())
                .earliestDate(request.getEarliestDate())
                .build();
        return statementImportService.importStatement(command);
    }

    @GetMapping("/sources")
    public List<ImportSource> getSources(
            @RequestHeader(value = OwnerResolver.OWNER_HEADER, required = false) String ownerId) {
        return importSourceService.listSources(ownerResolver.resolve(ownerId));
    }

    @DeleteMapping("/sources/{account}")
    public DeleteSourceResponse deleteSource(
            @RequestHeader(value = OwnerResolver.OWNER_HEADER, required = false) String ownerId,
            @PathVariable String account) {
        int deleted = importSourceService.deleteSource(ownerResolver.resolve(ownerId), account);
        return new DeleteSourceResponse(account, deleted);
    }

    private static String readStatement(ImportStatementRequest request) {
        try {
            return new String(request.getFile().getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ValidationException("Unable to read statement file", e);
        }
    }
}
