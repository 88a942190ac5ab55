package com.ordoAetheris.retail.analysis;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Plain-text sales report over already filtered transactions.
 */
public final class RetailReport {

    static final int TOP = 10;

    private final PrintStream out;

    public RetailReport(PrintStream out) {
        this.out = out;
    }

    public void print(List<Transaction> valid) {
        out.println("=== Online Retail Sales Analysis (UCI) ===");

        out.println();
        out.println("Total revenue (valid, non-cancelled):");
        out.println("  " + money(RetailAnalysis.totalRevenue(valid)));

        out.println();
        out.println("Revenue by country (top " + TOP + "):");
        List<Map.Entry<String, Double>> countries = new ArrayList<>(RetailAnalysis.revenueByCountry(valid).entrySet());
        countries.sort(Map.Entry.<String, Double>comparingByValue().reversed());
        for (Map.Entry<String, Double> e : countries.subList(0, Math.min(TOP, countries.size()))) {
            out.println(String.format(Locale.US, "  %-20s %s", e.getKey(), money(e.getValue())));
        }

        out.println();
        out.println("Monthly revenue (YYYY-MM):");
        new TreeMap<>(RetailAnalysis.monthlyRevenue(valid))
                .forEach((month, amount) -> out.println("  " + month + "  " + money(amount)));

        out.println();
        out.println("Top " + TOP + " products by revenue:");
        for (Map.Entry<String, Double> e : RetailAnalysis.topProductsByRevenue(valid, TOP)) {
            out.println(String.format(Locale.US, "  %-40s %s", clip(e.getKey()), money(e.getValue())));
        }

        out.println();
        out.println("Top " + TOP + " customers by revenue:");
        for (Map.Entry<String, Double> e : RetailAnalysis.topCustomersByRevenue(valid, TOP)) {
            out.println(String.format(Locale.US, "  %-10s %s", e.getKey(), money(e.getValue())));
        }

        out.println();
        out.println("Average order value (per invoice):");
        out.println("  " + money(RetailAnalysis.averageOrderValue(valid)));

        out.println();
        out.println("Units sold per product (first " + TOP + "):");
        RetailAnalysis.unitsSoldPerProduct(valid).entrySet().stream()
                .limit(TOP)
                .forEach(e -> out.println(String.format(Locale.US, "  %-40s %d units", clip(e.getKey()), e.getValue())));
    }

    public void printCancellationRate(double percent) {
        out.println();
        out.println("Cancellation rate (percentage of cancelled revenue over gross):");
        out.println(String.format(Locale.US, "  %.2f%%", percent));
    }

    static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    private static String clip(String name) {
        return name.length() > 40 ? name.substring(0, 40) : name;
    }
}
