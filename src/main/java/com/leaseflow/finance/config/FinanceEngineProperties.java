package com.leaseflow.finance.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Engine settings under {@code finance.engine.*}.
 * Company-level defaults are passed in here rather than looked up while computing.
 */
@Validated
@ConfigurationProperties(prefix = "finance.engine")
public class FinanceEngineProperties {

    /** Currency statistics and base amounts are reported in. */
    @NotBlank
    @Size(min = 3, max = 3)
    private String baseCurrency = "AED";

    /**
     * Largest difference, in minor units, between voucher lines and header total that still
     * counts as balanced.
     */
    @Min(0)
    private long balanceToleranceMinorUnits = 0;

    @NotBlank
    private String voucherNumberPrefix = "PV";

    @NotBlank
    private String reversalSuffix = "REV";

    /** Time zone used to decide "today" for overdue checks and recurrence. */
    @NotBlank
    private String zoneId = "Asia/Dubai";

    public String getBaseCurrency() {
        return baseCurrency;
    }

    public void setBaseCurrency(String baseCurrency) {
        this.baseCurrency = baseCurrency;
    }

    public long getBalanceToleranceMinorUnits() {
        return balanceToleranceMinorUnits;
    }

    public void setBalanceToleranceMinorUnits(long balanceToleranceMinorUnits) {
        this.balanceToleranceMinorUnits = balanceToleranceMinorUnits;
    }

    public String getVoucherNumberPrefix() {
        return voucherNumberPrefix;
    }

    public void setVoucherNumberPrefix(String voucherNumberPrefix) {
        this.voucherNumberPrefix = voucherNumberPrefix;
    }

    public String getReversalSuffix() {
        return reversalSuffix;
    }

    public void setReversalSuffix(String reversalSuffix) {
        this.reversalSuffix = reversalSuffix;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }
}
