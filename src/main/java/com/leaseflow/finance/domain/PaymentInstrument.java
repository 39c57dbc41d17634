package com.leaseflow.finance.domain;

import com.leaseflow.finance.exception.ValidationException;
import java.time.LocalDate;

/**
 * How a payment voucher is settled. Each payment type carries exactly the bank and cheque
 * details it needs, so a cheque without a cheque number cannot be constructed.
 */
public interface PaymentInstrument {

    PaymentType getType();

    record Cash() implements PaymentInstrument {
        @Override
        public PaymentType getType() {
            return PaymentType.CASH;
        }
    }

    record Cheque(String chequeNo, LocalDate chequeDate, Long bankId, String bankAccountNo)
        implements PaymentInstrument {

        public Cheque {
            requireText(chequeNo, "chequeNo", "Cheque number is required for cheque payments");
            requireBank(bankId, "Bank is required for cheque payments");
        }

        @Override
        public PaymentType getType() {
            return PaymentType.CHEQUE;
        }
    }

    record BankTransfer(Long bankId, String bankAccountNo, String transactionReference)
        implements PaymentInstrument {

        public BankTransfer {
            requireBank(bankId, "Bank is required for bank transfers");
            requireText(transactionReference, "transactionReference",
                "Transaction reference is required for bank transfers");
        }

        @Override
        public PaymentType getType() {
            return PaymentType.BANK_TRANSFER;
        }
    }

    record WireTransfer(Long bankId, String bankAccountNo, String transactionReference)
        implements PaymentInstrument {

        public WireTransfer {
            requireBank(bankId, "Bank is required for wire transfers");
            requireText(transactionReference, "transactionReference",
                "Transaction reference is required for wire transfers");
        }

        @Override
        public PaymentType getType() {
            return PaymentType.WIRE_TRANSFER;
        }
    }

    record Online(String transactionReference) implements PaymentInstrument {
        @Override
        public PaymentType getType() {
            return PaymentType.ONLINE;
        }
    }

    /**
     * Credit or debit card payment.
     */
    record Card(PaymentType type, String transactionReference) implements PaymentInstrument {

        public Card {
            if (type != PaymentType.CREDIT_CARD && type != PaymentType.DEBIT_CARD) {
                throw new ValidationException("Card payments must be credit or debit card", "paymentType");
            }
        }

        @Override
        public PaymentType getType() {
            return type;
        }
    }

    private static void requireText(String value, String field, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message, field);
        }
    }

    private static void requireBank(Long bankId, String message) {
        if (bankId == null) {
            throw new ValidationException(message, "bankId");
        }
    }
}
