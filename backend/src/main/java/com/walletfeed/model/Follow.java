package com.walletfeed.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.OffsetDateTime;

@Entity
@Table(name = "follow",
        uniqueConstraints = @UniqueConstraint(name = "uq_follow_src_dest",
                columnNames = {"src_id", "dest_id"}))
public class Follow {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "src_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WalletUser src;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dest_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WalletUser dest;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public WalletUser getSrc() {
        return src;
    }

    public void setSrc(WalletUser src) {
        this.src = src;
    }

    public WalletUser getDest() {
        return dest;
    }

    public void setDest(WalletUser dest) {
        this.dest = dest;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
