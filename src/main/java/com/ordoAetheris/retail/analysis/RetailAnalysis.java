package com.ordoAetheris.retail.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sequential reducers over transaction records.
 *
 * <p>Every function takes any {@link Iterable} of transactions, walks it once and
 * returns a fresh result; none of them keep state. Money amounts are rounded to
 * cents on the way out, never while accumulating.
 */
public final class RetailAnalysis {

    private RetailAnalysis() {
    }

    /** Not a cancellation, positive quantity, positive unit price. */
    public static boolean isValid(Transaction t) {
        return !t.isCancellation() && t.quantity() > 0 && t.unitPrice() > 0;
    }

    public static List<Transaction> validTransactions(Iterable<Transaction> records) {
        List<Transaction> result = new ArrayList<>();
        for (Transaction t : records) {
            if (isValid(t)) result.add(t);
        }
        return result;
    }

    public static double totalRevenue(Iterable<Transaction> records) {
        double total = 0.0;
        for (Transaction t : records) total += t.lineTotal();
        return round2(total);
    }

    public static Map<String, Double> revenueByCountry(Iterable<Transaction> records) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Transaction t : records) totals.merge(t.country(), t.lineTotal(), Double::sum);
        return roundValues(totals);
    }

    /** Revenue per calendar month, keyed {@code yyyy-MM}. */
    public static Map<String, Double> monthlyRevenue(Iterable<Transaction> records) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Transaction t : records) {
            String key = String.format("%04d-%02d", t.invoiceDate().getYear(), t.invoiceDate().getMonthValue());
            totals.merge(key, t.lineTotal(), Double::sum);
        }
        return roundValues(totals);
    }

    /** Products keyed by description, falling back to stock code when there is none. */
    public static List<Map.Entry<String, Double>> topProductsByRevenue(Iterable<Transaction> records, int n) {
        Map<String, Double> perProduct = new LinkedHashMap<>();
        for (Transaction t : records) {
            String key = t.description() != null ? t.description() : t.stockCode();
            perProduct.merge(key, t.lineTotal(), Double::sum);
        }
        return topN(perProduct, n);
    }

    /** Rows without a customer id are ignored. */
    public static List<Map.Entry<String, Double>> topCustomersByRevenue(Iterable<Transaction> records, int n) {
        Map<String, Double> perCustomer = new LinkedHashMap<>();
        for (Transaction t : records) {
            if (t.customerId() == null) continue;
            perCustomer.merge(t.customerId(), t.lineTotal(), Double::sum);
        }
        return topN(perCustomer, n);
    }

    /** Mean revenue per invoice; 0 when there are no invoices. */
    public static double averageOrderValue(Iterable<Transaction> records) {
        Map<String, Double> perInvoice = new HashMap<>();
        for (Transaction t : records) perInvoice.merge(t.invoiceNo(), t.lineTotal(), Double::sum);
        if (perInvoice.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : perInvoice.values()) sum += v;
        return round2(sum / perInvoice.size());
    }

    /** Units keyed by stock code, falling back to description when the code is blank. */
    public static Map<String, Integer> unitsSoldPerProduct(Iterable<Transaction> records) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Transaction t : records) {
            String key = t.stockCode().isEmpty() && t.description() != null ? t.description() : t.stockCode();
            counts.merge(key, t.quantity(), Integer::sum);
        }
        return counts;
    }

    /**
     * Cancelled revenue as a percentage of gross revenue, both by absolute line value.
     * Meant for raw records, cancellations included.
     */
    public static double cancellationRate(Iterable<Transaction> records) {
        double total = 0.0;
        double cancelled = 0.0;
        for (Transaction t : records) {
            double value = Math.abs(t.lineTotal());
            total += value;
            if (t.isCancellation()) cancelled += value;
        }
        if (total == 0.0) return 0.0;
        return round2(100.0 * cancelled / total);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static Map<String, Double> roundValues(Map<String, Double> totals) {
        Map<String, Double> rounded = new LinkedHashMap<>();
        totals.forEach((k, v) -> rounded.put(k, round2(v)));
        return rounded;
    }

    // stable: ties keep first-seen order
    private static List<Map.Entry<String, Double>> topN(Map<String, Double> totals, int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0, got " + n);
        List<Map.Entry<String, Double>> sorted = new ArrayList<>(totals.entrySet());
        sorted.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()));
        List<Map.Entry<String, Double>> result = new ArrayList<>();
        for (Map.Entry<String, Double> e : sorted.subList(0, Math.min(n, sorted.size()))) {
            result.add(Map.entry(e.getKey(), round2(e.getValue())));
        }
        return result;
    }
}
