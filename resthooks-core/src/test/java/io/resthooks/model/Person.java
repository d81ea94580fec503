package io.resthooks.model;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;

import java.util.ArrayList;
import java.util.List;

@Entity
public class Person {
    @Id
    public Long id;
    public String name;

    @OneToOne(mappedBy = "owner")
    public Article ownedArticle;

    @OneToMany(mappedBy = "author")
    public List<Article> articles;

    // Unidirectional, may point back at itself
    @ManyToMany
    public List<Person> friends;

    public Person() {
    }

    public Person(Long id, String name) {
        this.id = id;
        this.name = name;
    }

    public Person withFriends(Person... friends) {
        this.friends = new ArrayList<>(List.of(friends));
        return this;
    }
}
