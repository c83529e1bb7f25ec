package org.iceforge.pivot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PivotCubeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PivotCubeEngineApplication.class, args);
    }
}
