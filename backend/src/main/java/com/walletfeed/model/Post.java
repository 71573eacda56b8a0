package com.walletfeed.model;

import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "post")
public class Post {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private WalletUser author;

    @Column(columnDefinition = "TEXT")
    private String text;

    @Column(name = "image_url", length = 1024)
    private String imageUrl;

    @Column(name = "is_share", nullable = false, updatable = false)
    private Boolean isShare = false;

    @Column(name = "is_quote", nullable = false, updatable = false)
    private Boolean isQuote = false;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ref_post_id", updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Post refPost;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ref_tx_id", updatable = false)
    private Transaction refTx;

    @ManyToMany
    @JoinTable(name = "post_tagged_user",
            joinColumns = @JoinColumn(name = "post_id"),
            inverseJoinColumns = @JoinColumn(name = "wallet_user_id"))
    private Set<WalletUser> taggedUsers = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public WalletUser getAuthor() {
        return author;
    }

    public void setAuthor(WalletUser author) {
        this.author = author;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Boolean getIsShare() {
        return isShare;
    }

    public void setIsShare(Boolean isShare) {
        this.isShare = isShare;
    }

    public Boolean getIsQuote() {
        return isQuote;
    }

    public void setIsQuote(Boolean isQuote) {
        this.isQuote = isQuote;
    }

    public Post getRefPost() {
        return refPost;
    }

    public void setRefPost(Post refPost) {
        this.refPost = refPost;
    }

    public Transaction getRefTx() {
        return refTx;
    }

    public void setRefTx(Transaction refTx) {
        this.refTx = refTx;
    }

    public Set<WalletUser> getTaggedUsers() {
        return taggedUsers;
    }

    public void setTaggedUsers(Set<WalletUser> taggedUsers) {
        this.taggedUsers = taggedUsers;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
