package io.github.cyfko.whereql.jpa.entities;

import jakarta.persistence.*;

@Entity
@Table(name = "owners")
public class Owner {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    private String name;

    public Owner() {}
    public Owner(String name) {
        this.name = name;
    }

    public Long getId() { return id; }
    public String getName() { return name; }
}
