package com.walletfeed.model;

import jakarta.persistence.*;

/**
 * Contract metadata and endpoints shared by ERC-20 and ERC-721 line items.
 */
@MappedSuperclass
public abstract class TokenTransfer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tx_id", nullable = false, updatable = false)
    private Transaction transaction;

    @Column(name = "contract_address", nullable = false, updatable = false, length = 42)
    private String contractAddress;

    @Column(name = "contract_name", updatable = false, length = 255)
    private String contractName;

    @Column(name = "contract_ticker", updatable = false, length = 255)
    private String contractTicker;

    @Column(name = "logo_url", updatable = false, length = 1024)
    private String logoUrl;

    @Column(name = "from_address", nullable = false, updatable = false, length = 42)
    private String fromAddress;

    @Column(name = "to_address", nullable = false, updatable = false, length = 42)
    private String toAddress;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public void setTransaction(Transaction transaction) {
        this.transaction = transaction;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public String getContractName() {
        return contractName;
    }

    public void setContractName(String contractName) {
        this.contractName = contractName;
    }

    public String getContractTicker() {
        return contractTicker;
    }

    public void setContractTicker(String contractTicker) {
        this.contractTicker = contractTicker;
    }

    public String getLogoUrl() {
        return logoUrl;
    }

    public void setLogoUrl(String logoUrl) {
        this.logoUrl = logoUrl;
    }

    public String getFromAddress() {
        return fromAddress;
    }

    public void setFromAddress(String fromAddress) {
        this.fromAddress = fromAddress;
    }

    public String getToAddress() {
        return toAddress;
    }

    public void setToAddress(String toAddress) {
        this.toAddress = toAddress;
    }
}
