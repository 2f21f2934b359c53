package it.aw.collectionindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollectionIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollectionIndexApplication.class, args);
    }
}
