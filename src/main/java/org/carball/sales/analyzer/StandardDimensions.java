package org.carball.sales.analyzer;

import org.carball.sales.model.aggregation.AggregationRequest;
import org.carball.sales.model.aggregation.GroupingKey;
import org.carball.sales.model.aggregation.MetricSpec;
import org.carball.sales.model.aggregation.RatioMetric;
import org.carball.sales.model.record.SalesField;

import java.util.List;

/**
 * The dimensional breakdowns produced by every analysis run.
 */
public final class StandardDimensions {

    public static final String TOTAL_SALES = "Total Sales";
    public static final String AVG_TRANSACTION = "Avg Transaction";
    public static final String NUM_TRANSACTIONS = "Num Transactions";
    public static final String TOTAL_UNITS = "Total Units";
    public static final String UNIQUE_CUSTOMERS = "Unique Customers";
    public static final String AVG_UNIT_PRICE = "Avg Unit Price";
    public static final String AVG_SALE = "Avg Sale";
    public static final String NUM_SALES = "Num Sales";
    public static final String SALES_PER_CUSTOMER = "Sales per Customer";

    public static final String MARKET_SHARE = "Market Share %";
    public static final String REVENUE_CONTRIBUTION = "Revenue Contribution %";
    public static final String SALES_SHARE = "Sales Share %";
    public static final String REVENUE_SHARE = "Revenue Share %";

    private StandardDimensions() {
        // Utility class - prevent instantiation
    }

    public static AggregationRequest region() {
        return AggregationRequest.builder()
                .name("regional_analysis")
                .grouping(GroupingKey.of(SalesField.REGION))
                .metric(MetricSpec.sum(SalesField.SALES_AMOUNT, TOTAL_SALES))
                .metric(MetricSpec.mean(SalesField.SALES_AMOUNT, AVG_TRANSACTION))
                .metric(MetricSpec.count(SalesField.SALES_AMOUNT, NUM_TRANSACTIONS))
                .metric(MetricSpec.sum(SalesField.UNITS_SOLD, TOTAL_UNITS))
                .metric(MetricSpec.nunique(SalesField.CUSTOMER_ID, UNIQUE_CUSTOMERS))
                .primaryMetric(TOTAL_SALES)
                .shareLabel(MARKET_SHARE)
                .build();
    }

    public static AggregationRequest category() {
        return AggregationRequest.builder()
                .name("category_analysis")
                .grouping(GroupingKey.of(SalesField.PRODUCT_CATEGORY))
                .metric(MetricSpec.sum(SalesField.SALES_AMOUNT, TOTAL_SALES))
                .metric(MetricSpec.mean(SalesField.SALES_AMOUNT, AVG_TRANSACTION))
                .metric(MetricSpec.count(SalesField.SALES_AMOUNT, NUM_TRANSACTIONS))
                .metric(MetricSpec.sum(SalesField.UNITS_SOLD, TOTAL_UNITS))
                .metric(MetricSpec.mean(SalesField.UNIT_PRICE, AVG_UNIT_PRICE))
                .primaryMetric(TOTAL_SALES)
                .shareLabel(REVENUE_CONTRIBUTION)
                .build();
    }

    public static AggregationRequest salesRep() {
        return AggregationRequest.builder()
                .name("rep_analysis")
                .grouping(GroupingKey.of(SalesField.SALES_REP))
                .metric(MetricSpec.sum(SalesField.SALES_AMOUNT, TOTAL_SALES))
                .metric(MetricSpec.mean(SalesField.SALES_AMOUNT, AVG_SALE))
                .metric(MetricSpec.count(SalesField.SALES_AMOUNT, NUM_SALES))
                .metric(MetricSpec.nunique(SalesField.CUSTOMER_ID, UNIQUE_CUSTOMERS))
                .ratio(new RatioMetric(SALES_PER_CUSTOMER, TOTAL_SALES, UNIQUE_CUSTOMERS))
                .primaryMetric(TOTAL_SALES)
                .shareLabel(SALES_SHARE)
                .build();
    }

    /**
     * Revenue by region and category together, the data behind the revenue heatmap.
     */
    public static AggregationRequest regionCategory() {
        return AggregationRequest.builder()
                .name("region_category_analysis")
                .grouping(GroupingKey.of(SalesField.REGION, SalesField.PRODUCT_CATEGORY))
                .metric(MetricSpec.sum(SalesField.SALES_AMOUNT, TOTAL_SALES))
                .metric(MetricSpec.count(SalesField.SALES_AMOUNT, NUM_TRANSACTIONS))
                .primaryMetric(TOTAL_SALES)
                .shareLabel(REVENUE_SHARE)
                .build();
    }

    public static List<AggregationRequest> all() {
        return List.of(region(), category(), salesRep(), regionCategory());
    }
}
