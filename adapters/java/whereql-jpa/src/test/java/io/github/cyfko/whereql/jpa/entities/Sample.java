package io.github.cyfko.whereql.jpa.entities;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "samples")
public class Sample {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    private String str;
    private Integer number;
    private Double ratio;
    private LocalDateTime datetime;
    @Enumerated(EnumType.STRING)
    private Status status;
    @ManyToOne
    private Owner owner;

    public enum Status { ACTIVE, ARCHIVED }

    public Sample() {}
    public Sample(String str, Integer number, Double ratio, LocalDateTime datetime, Status status, Owner owner) {
        this.str = str;
        this.number = number;
        this.ratio = ratio;
        this.datetime = datetime;
        this.status = status;
        this.owner = owner;
    }

    public Long getId() { return id; }
    public String getStr() { return str; }
    public Integer getNumber() { return number; }
    public Double getRatio() { return ratio; }
    public LocalDateTime getDatetime() { return datetime; }
    public Status getStatus() { return status; }
    public Owner getOwner() { return owner; }
}
