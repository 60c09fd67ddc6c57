package com.example.tracepipeline.worker;

import com.example.tracepipeline.queue.NonRetryableJobException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * 载荷字段校验。缺字段或格式错误的载荷重试也不会变好，一律不可重试。
 */
final class PayloadFields {

    private PayloadFields() {
    }

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new NonRetryableJobException(field + " is required");
        }
        return value;
    }

    /**
     * 解析 yyyy-MM-dd 日期，为空时取 UTC 昨天。
     */
    static LocalDate dateOrYesterday(String date, Clock clock) {
        if (date == null || date.isBlank()) {
            return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).minusDays(1);
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new NonRetryableJobException("invalid date format: " + date, e);
        }
    }
}
