package com.motaz.fraudscan.services;

import com.motaz.fraudscan.engine.model.FraudAlert;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Renders alerts as comma-separated rows, one per alert. Text fields are
 * quoted, numbers are not.
 */
@Service
public class AlertExportService {

    static final String HEADER = "provider_id,provider_name,state_code,procedure_code,procedure_description,"
            + "period,current_amount,comparison_amount,deviation_percent,severity";

    public String exportAlertsAsDelimitedText(List<FraudAlert> alerts) {
        StringBuilder csv = new StringBuilder(HEADER).append('\n');
        for (FraudAlert alert : alerts) {
            csv.append(quote(alert.getProviderId())).append(',')
                    .append(quote(alert.getProviderName())).append(',')
                    .append(quote(alert.getStateCode())).append(',')
                    .append(quote(alert.getProcedureCode())).append(',')
                    .append(quote(alert.getProcedureDescription())).append(',')
                    .append(quote(alert.getPeriod())).append(',')
                    .append(number(alert.getCurrentAmount())).append(',')
                    .append(number(alert.getComparisonAmount())).append(',')
                    .append(number(BigDecimal.valueOf(alert.getDeviationPercent()))).append(',')
                    .append(quote(alert.getSeverity().label()))
                    .append('\n');
        }
        return csv.toString();
    }

    private static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String number(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
