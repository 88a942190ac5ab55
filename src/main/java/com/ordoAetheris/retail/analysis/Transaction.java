package com.ordoAetheris.retail.analysis;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One line item of the UCI "Online Retail" data set.
 *
 * <p>Fields follow the CSV columns: InvoiceNo, StockCode, Description, Quantity,
 * InvoiceDate, UnitPrice, CustomerID, Country. {@code description} and
 * {@code customerId} may be {@code null}.
 */
public final class Transaction {

    private final String invoiceNo;
    private final String stockCode;
    private final String description;
    private final int quantity;
    private final LocalDateTime invoiceDate;
    private final double unitPrice;
    private final String customerId;
    private final String country;

    public Transaction(String invoiceNo,
                       String stockCode,
                       String description,
                       int quantity,
                       LocalDateTime invoiceDate,
                       double unitPrice,
                       String customerId,
                       String country) {
        this.invoiceNo = Objects.requireNonNull(invoiceNo, "invoiceNo");
        this.stockCode = Objects.requireNonNull(stockCode, "stockCode");
        this.description = description;
        this.quantity = quantity;
        this.invoiceDate = Objects.requireNonNull(invoiceDate, "invoiceDate");
        this.unitPrice = unitPrice;
        this.customerId = customerId;
        this.country = Objects.requireNonNull(country, "country");
    }

    public String invoiceNo() {
        return invoiceNo;
    }

    public String stockCode() {
        return stockCode;
    }

    public String description() {
        return description;
    }

    public int quantity() {
        return quantity;
    }

    public LocalDateTime invoiceDate() {
        return invoiceDate;
    }

    public double unitPrice() {
        return unitPrice;
    }

    public String customerId() {
        return customerId;
    }

    public String country() {
        return country;
    }

    public double lineTotal() {
        return quantity * unitPrice;
    }

    /** Invoice numbers starting with 'C' are cancellations. */
    public boolean isCancellation() {
        return invoiceNo.startsWith("C");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction that = (Transaction) o;
        return quantity == that.quantity
                && Double.compare(that.unitPrice, unitPrice) == 0
                && invoiceNo.equals(that.invoiceNo)
                && stockCode.equals(that.stockCode)
                && Objects.equals(description, that.description)
                && invoiceDate.equals(that.invoiceDate)
                && Objects.equals(customerId, that.customerId)
                && country.equals(that.country);
    }

    @Override
    public int hashCode() {
        return Objects.hash(invoiceNo, stockCode, description, quantity, invoiceDate, unitPrice, customerId, country);
    }

    @Override
    public String toString() {
        return "Transaction{" + invoiceNo + ", " + stockCode + ", qty=" + quantity
                + ", price=" + unitPrice + ", customer=" + customerId + ", " + country + "}";
    }
}
