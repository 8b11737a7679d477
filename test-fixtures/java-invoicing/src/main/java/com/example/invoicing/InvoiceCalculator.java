package com.example.invoicing;

import java.util.ArrayList;
import java.util.List;

public class InvoiceCalculator {

    private final List<String> lines = new ArrayList<>();
    private double runningTotal;

    public double lineTotal(double price, int quantity) {
        double amount = price * quantity;
        return amount;
    }

    public double invoice(double price, int quantity, double discount) {
        double gross = lineTotal(price, quantity);
        double net = gross - discount;
        if (net < 0) {
            net = 0;
        }
        runningTotal += net;
        lines.add("net=" + net);
        System.out.println("Invoice net " + net);
        return net;
    }

    public String describe(String customer) {
        String label = null;
        if (customer != null) {
            label = "Invoice for " + customer;
        }
        return label;
    }
}
