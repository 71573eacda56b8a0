package com.walletfeed.model;

import jakarta.persistence.*;

import java.math.BigInteger;

@Entity
@Table(name = "erc20_transfer")
public class Erc20Transfer extends TokenTransfer {

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(nullable = false, updatable = false)
    private Integer decimals;

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public Integer getDecimals() {
        return decimals;
    }

    public void setDecimals(Integer decimals) {
        this.decimals = decimals;
    }
}
