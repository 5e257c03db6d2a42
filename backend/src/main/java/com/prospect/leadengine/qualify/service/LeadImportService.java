package com.prospect.leadengine.qualify.service;

import com.prospect.leadengine.qualify.model.CloudMaturity;
import com.prospect.leadengine.qualify.model.CompanySize;
import com.prospect.leadengine.qualify.model.DecisionMaker;
import com.prospect.leadengine.qualify.model.InvalidLeadException;
import com.prospect.leadengine.qualify.model.Lead;
import com.prospect.leadengine.qualify.model.Sector;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads leads from a header-based CSV file. Enum columns with unknown values become null; list columns are
 * {@code ;}-separated.
 */
@Service
public class LeadImportService {
    private static final Logger log = LoggerFactory.getLogger(LeadImportService.class);
    private static final String LIST_SEPARATOR = ";";

    public ImportResult parse(Reader reader, String source) {
        List<Lead> leads = new ArrayList<>();
        List<ImportResult.RowError> errors = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                long row = record.getRecordNumber();
                try {
                    leads.add(toLead(record, source));
                } catch (InvalidLeadException e) {
                    log.debug("Skipping import row {}: {}", row, e.getMessage());
                    errors.add(new ImportResult.RowError(row, e.getMessage()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read lead import", e);
        } catch (IllegalStateException | IllegalArgumentException | UncheckedIOException e) {
            // Malformed CSV surfaces mid-iteration; keep the rows read so far.
            log.warn("Lead import stopped early after {} rows: {}", leads.size() + errors.size(), e.getMessage());
            errors.add(new ImportResult.RowError(leads.size() + errors.size() + 1L, rootMessage(e)));
        }
        log.info("Imported {} leads, {} rows rejected", leads.size(), errors.size());
        return new ImportResult(leads, errors);
    }

    Lead toLead(CSVRecord record, String source) {
        String companyName = getColumn(record, "company_name", "company", "name");
        if (companyName == null) {
            throw new InvalidLeadException("company_name is required");
        }
        Lead.Builder builder = Lead.builder(companyName)
            .taxId(getColumn(record, "tax_id"))
            .website(getColumn(record, "website", "url"))
            .email(getColumn(record, "email"))
            .phone(getColumn(record, "phone"))
            .address(getColumn(record, "address"))
            .city(getColumn(record, "city"))
            .region(getColumn(record, "region"))
            .sector(Sector.fromValue(getColumn(record, "sector")))
            .companySize(CompanySize.fromValue(getColumn(record, "company_size", "size")))
            .employeeCount(parseInteger(getColumn(record, "employee_count", "employees"), "employee_count"))
            .annualRevenue(parseDouble(getColumn(record, "annual_revenue", "revenue"), "annual_revenue"))
            .profileUrl(getColumn(record, "profile_url"))
            .technologies(splitList(getColumn(record, "technologies")))
            .cloudMaturity(CloudMaturity.fromValue(getColumn(record, "cloud_maturity")))
            .usesTargetCloud(parseBoolean(getColumn(record, "uses_target_cloud", "uses_aws")))
            .competitorCloud(getColumn(record, "competitor_cloud"))
            .painPoints(splitList(getColumn(record, "pain_points")))
            .notes(getColumn(record, "notes"))
            .source(firstNonBlank(getColumn(record, "source"), source));

        String contactProfile = getColumn(record, "contact_profile_url");
        String contactName = getColumn(record, "contact_name");
        if (contactProfile != null || contactName != null) {
            builder.decisionMakers(List.of(new DecisionMaker(
                contactName,
                getColumn(record, "contact_role"),
                contactProfile,
                getColumn(record, "contact_email"),
                getColumn(record, "contact_phone")
            )));
        }
        return builder.build();
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.getParser().getHeaderNames()) {
                if (header == null || !header.trim().equalsIgnoreCase(name) || !record.isSet(header)) {
                    continue;
                }
                String value = record.get(header).trim();
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private List<String> splitList(String raw) {
        if (raw == null) {
            return List.of();
        }
        return Arrays.stream(raw.split(LIST_SEPARATOR))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .toList();
    }

    private Integer parseInteger(String raw, String column) {
        if (raw == null) {
            return null;
        }
        try {
            return Integer.parseInt(raw.replace(",", "").replace("_", ""));
        } catch (NumberFormatException e) {
            throw new InvalidLeadException(column + " is not a whole number: " + raw);
        }
    }

    private Double parseDouble(String raw, String column) {
        if (raw == null) {
            return null;
        }
        try {
            return Double.parseDouble(raw.replace(",", "").replace("_", ""));
        } catch (NumberFormatException e) {
            throw new InvalidLeadException(column + " is not a number: " + raw);
        }
    }

    private boolean parseBoolean(String raw) {
        if (raw == null) {
            return false;
        }
        String normalized = raw.toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1") || normalized.equals("y");
    }

    private String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second.trim();
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }
}
