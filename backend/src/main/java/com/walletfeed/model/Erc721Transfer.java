package com.walletfeed.model;

import jakarta.persistence.*;

import java.math.BigInteger;

@Entity
@Table(name = "erc721_transfer")
public class Erc721Transfer extends TokenTransfer {

    @Column(name = "token_id", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger tokenId;

    public BigInteger getTokenId() {
        return tokenId;
    }

    public void setTokenId(BigInteger tokenId) {
        this.tokenId = tokenId;
    }
}
