package com.fature.cpa.adapter.in.web.validation;

import com.fature.cpa.domain.model.ValidationInput;
import com.fature.cpa.domain.model.ValidationOption;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validates incoming CPA validation requests: required fields, value types and ranges
 */
public class CpaRequestValidator {

    public static final List<String> REQUIRED_FIELDS = List.of(
            "affiliateId", "userId", "depositAmount", "betCount", "ggrAmount", "registrationDate"
    );

    // yyyy-MM-dd with optional time and optional offset
    private static final DateTimeFormatter REGISTRATION_DATE_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    public RequestValidation validate(CpaValidationRequest request) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(request, errors);
        validateValues(request, errors);

        if (errors.isEmpty()) {
            return RequestValidation.valid();
        } else {
            return RequestValidation.invalid(errors);
        }
    }

    /**
     * Convert a request that passed {@link #validate} into engine input
     */
    public ValidationInput toInput(CpaValidationRequest request) {
        return ValidationInput.builder()
                .affiliateId(request.affiliateId())
                .userId(request.userId())
                .depositAmount(request.depositAmount())
                .betCount(request.betCount().longValueExact())
                .ggrAmount(request.ggrAmount())
                .registrationDate(parseRegistrationDate(request.registrationDate())
                        .orElseThrow(() -> new IllegalArgumentException("registrationDate must be a valid date")))
                .validationOption(isBlank(request.validationOption())
                        ? ValidationOption.DEFAULT
                        : ValidationOption.fromValue(request.validationOption()))
                .build();
    }

    /**
     * Accepts an ISO instant or offset date-time, or a local date-time / date taken as UTC
     */
    public static Optional<Instant> parseRegistrationDate(String value) {
        if (isBlank(value)) {
            return Optional.empty();
        }
        try {
            TemporalAccessor parsed = REGISTRATION_DATE_FORMAT.parseBest(value.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime) {
                return Optional.of(((OffsetDateTime) parsed).toInstant());
            }
            if (parsed instanceof LocalDateTime) {
                return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
            }
            return Optional.of(((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private void validateRequiredFields(CpaValidationRequest request, List<String> errors) {
        if (isBlank(request.affiliateId())) {
            errors.add("affiliateId is required");
        }
        if (isBlank(request.userId())) {
            errors.add("userId is required");
        }
        if (request.depositAmount() == null) {
            errors.add("depositAmount is required");
        }
        if (request.betCount() == null) {
            errors.add("betCount is required");
        }
        if (request.ggrAmount() == null) {
            errors.add("ggrAmount is required");
        }
        if (isBlank(request.registrationDate())) {
            errors.add("registrationDate is required");
        }
    }

    private void validateValues(CpaValidationRequest request, List<String> errors) {
        if (request.depositAmount() != null && request.depositAmount().compareTo(BigDecimal.ZERO) < 0) {
            errors.add("depositAmount must be a positive number");
        }

        if (request.betCount() != null) {
            if (request.betCount().compareTo(BigDecimal.ZERO) < 0 || !isWholeNumber(request.betCount())) {
                errors.add("betCount must be a positive integer");
            }
        }

        if (!isBlank(request.registrationDate()) && parseRegistrationDate(request.registrationDate()).isEmpty()) {
            errors.add("registrationDate must be a valid date");
        }

        if (!isBlank(request.validationOption()) && !ValidationOption.isValid(request.validationOption())) {
            errors.add("validationOption must be \"opcao1\" or \"opcao2\"");
        }
    }

    private static boolean isWholeNumber(BigDecimal value) {
        try {
            value.longValueExact();
            return true;
        } catch (ArithmeticException e) {
            return false;
        }
    }

    private static boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
