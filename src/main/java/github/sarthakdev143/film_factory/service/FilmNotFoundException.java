package github.sarthakdev143.film_factory.service;

import java.util.NoSuchElementException;

public class FilmNotFoundException extends NoSuchElementException {

    public FilmNotFoundException(String filmId) {
        super("Film not found: " + filmId);
    }
}
