package com.walletfeed.model;

import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * On-chain transaction pulled from the history provider.
 * Rows are append-only; (chainId, txHash) is the dedup key.
 */
@Entity
@Table(name = "chain_transaction",
        uniqueConstraints = @UniqueConstraint(name = "uq_chain_transaction_chain_hash",
                columnNames = {"chain_id", "tx_hash"}))
public class Transaction {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "chain_id", nullable = false, updatable = false)
    private Integer chainId;

    @Column(name = "tx_hash", nullable = false, updatable = false, length = 66)
    private String txHash;

    @Column(name = "block_signed_at", nullable = false, updatable = false)
    private OffsetDateTime blockSignedAt;

    @Column(name = "tx_offset", nullable = false, updatable = false)
    private Integer txOffset;

    @Column(nullable = false, updatable = false)
    private Boolean successful;

    @Column(name = "from_address", nullable = false, updatable = false, length = 42)
    private String fromAddress;

    @Column(name = "to_address", length = 42, updatable = false)
    private String toAddress;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger value = BigInteger.ZERO;

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Erc20Transfer> erc20Transfers = new ArrayList<>();

    @OneToMany(mappedBy = "transaction", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Erc721Transfer> erc721Transfers = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public void addErc20Transfer(Erc20Transfer transfer) {
        transfer.setTransaction(this);
        erc20Transfers.add(transfer);
    }

    public void addErc721Transfer(Erc721Transfer transfer) {
        transfer.setTransaction(this);
        erc721Transfers.add(transfer);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Integer getChainId() {
        return chainId;
    }

    public void setChainId(Integer chainId) {
        this.chainId = chainId;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public OffsetDateTime getBlockSignedAt() {
        return blockSignedAt;
    }

    public void setBlockSignedAt(OffsetDateTime blockSignedAt) {
        this.blockSignedAt = blockSignedAt;
    }

    public Integer getTxOffset() {
        return txOffset;
    }

    public void setTxOffset(Integer txOffset) {
        this.txOffset = txOffset;
    }

    public Boolean getSuccessful() {
        return successful;
    }

    public void setSuccessful(Boolean successful) {
        this.successful = successful;
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

    public BigInteger getValue() {
        return value;
    }

    public void setValue(BigInteger value) {
        this.value = value;
    }

    public List<Erc20Transfer> getErc20Transfers() {
        return erc20Transfers;
    }

    public void setErc20Transfers(List<Erc20Transfer> erc20Transfers) {
        this.erc20Transfers = erc20Transfers;
    }

    public List<Erc721Transfer> getErc721Transfers() {
        return erc721Transfers;
    }

    public void setErc721Transfers(List<Erc721Transfer> erc721Transfers) {
        this.erc721Transfers = erc721Transfers;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
