package com.openforge.taskcore.extraction;

import com.openforge.taskcore.domain.ParameterSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renames near-miss keys the model invents ({@code customer_id}, {@code csv}, …)
 * to the names the template schema declares. A canonical key that is already
 * present is never overwritten; the first alias found wins.
 */
@Slf4j
@Component
public class ParameterNameNormalizer {

    static final Map<String, List<String>> ALIASES = Map.of(
            "csvData",    List.of("customer_list_csv", "csv_data", "csv", "customerListCsv", "list_data"),
            "customerId", List.of("customer_id", "customid", "cid"),
            "companyId",  List.of("company_id", "companyid"),
            "contactId",  List.of("contact_id", "contactid"),
            "dealId",     List.of("deal_id", "dealid"),
            "invoiceId",  List.of("invoice_id", "invoiceid"),
            "dateRange",  List.of("date_range", "range", "period")
    );

    public Map<String, Object> normalize(Map<String, Object> parameters, ParameterSchema schema) {
        if (schema == null || !schema.hasProperties()) return parameters;

        Map<String, Object> normalized = new LinkedHashMap<>(parameters);
        for (String canonical : schema.properties().keySet()) {
            if (parameters.containsKey(canonical)) continue;

            for (String alias : ALIASES.getOrDefault(canonical, List.of())) {
                if (parameters.containsKey(alias)) {
                    log.info("[Extractor] Renaming parameter '{}' to schema name '{}'", alias, canonical);
                    normalized.put(canonical, normalized.remove(alias));
                    break;
                }
            }
        }
        return normalized;
    }
}
