package com.flagship.statement_report.transaction;

import com.flagship.statement_report.amount.AmountParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parses the tab-delimited transaction log.
 *
 * Field layout by position:
 * <pre>
 *   payment:  type, account, timestamp, method, card/check number, amount
 *   purchase: type, account, timestamp, merchant, amount
 * </pre>
 * Cash payments usually omit the number field, and any line may be cut
 * short. Missing fields default to empty text and a missing or malformed
 * amount defaults to zero. A line never fails to parse.
 */
@Component
@Slf4j
public class TransactionParser {

    private static final String FIELD_SEPARATOR = "\t";
    private static final String LINE_SEPARATOR = "\r\n|\r|\n";

    private static final int TYPE_FIELD = 0;
    private static final int ACCOUNT_FIELD = 1;
    private static final int TIMESTAMP_FIELD = 2;
    private static final int MERCHANT_OR_METHOD_FIELD = 3;
    private static final int REFERENCE_FIELD = 4;
    private static final int PAYMENT_AMOUNT_FIELD = 5;

    /**
     * Parses the whole log. Blank lines are skipped, but every transaction
     * keeps the zero-based index of its line as sequence number.
     *
     * @param logText full contents of the transaction log
     * @return transactions in file order
     */
    public List<Transaction> parseAll(String logText) {
        List<Transaction> transactions = new ArrayList<>();
        String[] lines = logText.split(LINE_SEPARATOR);
        for (int lineIndex = 0; lineIndex < lines.length; lineIndex++) {
            if (lines[lineIndex].isBlank()) {
                continue;
            }
            transactions.add(parseLine(lines[lineIndex], lineIndex));
        }
        return Collections.unmodifiableList(transactions);
    }

    /**
     * Parses one log line.
     *
     * @param line raw line, without its line terminator
     * @param sequenceNumber zero-based position of the line in the log
     */
    public Transaction parseLine(String line, long sequenceNumber) {
        List<String> fields = Arrays.asList(line.split(FIELD_SEPARATOR, -1));

        TransactionType type = TransactionType.fromTag(fieldAt(fields, TYPE_FIELD));
        if (type == TransactionType.UNKNOWN) {
            log.debug("Transaction {} has unrecognised type '{}'", sequenceNumber, fieldAt(fields, TYPE_FIELD));
        }

        int accountNumber = parseAccountNumber(fieldAt(fields, ACCOUNT_FIELD), sequenceNumber);
        String timestamp = fieldAt(fields, TIMESTAMP_FIELD);
        String merchant = stripQuotes(fieldAt(fields, MERCHANT_OR_METHOD_FIELD));

        PaymentDetails details = type == TransactionType.PAYMENT
            ? parsePaymentDetails(fields)
            : PaymentDetails.NOT_A_PAYMENT;
        if (details.getMethod() == PaymentMethod.UNKNOWN) {
            log.debug("Payment {} has unrecognised method '{}'",
                sequenceNumber, fieldAt(fields, MERCHANT_OR_METHOD_FIELD));
        }

        String amountText = selectAmountField(fields);
        if (!amountText.isEmpty() && !AmountParser.isWellFormed(amountText)) {
            log.debug("Transaction {} has malformed amount '{}', using zero", sequenceNumber, amountText);
        }
        BigDecimal amount = AmountParser.parse(amountText);

        return new Transaction(
            type,
            sequenceNumber,
            accountNumber,
            timestamp,
            merchant,
            details.getMethod(),
            details.getReferenceNumber(),
            amount
        );
    }

    /**
     * Reads the payment-method fields of a payment line.
     *
     * Cash ignores any further fields. Credit and check take the card or
     * check number from the field after the method and the amount from the
     * one after that. Any other method is {@link PaymentMethod#UNKNOWN}.
     *
     * @param fields all fields of the line, type first
     */
    public PaymentDetails parsePaymentDetails(List<String> fields) {
        String methodName = fieldAt(fields, MERCHANT_OR_METHOD_FIELD).trim().toLowerCase(Locale.ROOT);
        return switch (methodName) {
            case "cash" -> new PaymentDetails(PaymentMethod.CASH, "", "");
            case "credit" -> referencedPayment(PaymentMethod.CREDIT, fields);
            case "check" -> referencedPayment(PaymentMethod.CHECK, fields);
            default -> new PaymentDetails(PaymentMethod.UNKNOWN, "", "0");
        };
    }

    private PaymentDetails referencedPayment(PaymentMethod method, List<String> fields) {
        String referenceNumber = fieldAt(fields, REFERENCE_FIELD);
        String amountText = fields.size() > PAYMENT_AMOUNT_FIELD ? fields.get(PAYMENT_AMOUNT_FIELD) : "0";
        return new PaymentDetails(method, referenceNumber, amountText);
    }

    /**
     * Six or more fields: the amount follows the card/check number.
     * Five fields: the amount follows the merchant or method.
     * Fewer: no amount.
     */
    private String selectAmountField(List<String> fields) {
        if (fields.size() > PAYMENT_AMOUNT_FIELD) {
            return fields.get(PAYMENT_AMOUNT_FIELD);
        }
        if (fields.size() > REFERENCE_FIELD) {
            return fields.get(REFERENCE_FIELD);
        }
        return "";
    }

    private int parseAccountNumber(String field, long sequenceNumber) {
        try {
            return Integer.parseInt(field.trim());
        } catch (NumberFormatException e) {
            log.debug("Transaction {} has unparsable account number '{}'", sequenceNumber, field);
            return Transaction.UNPARSED_ACCOUNT_NUMBER;
        }
    }

    private static String fieldAt(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : "";
    }

    private static String stripQuotes(String value) {
        return value.trim().replaceAll("^\"|\"$", "");
    }
}
