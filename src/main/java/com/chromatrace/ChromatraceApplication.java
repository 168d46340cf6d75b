package com.chromatrace;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class ChromatraceApplication {

    public static void main(String[] args) {
        // No web server: sessions are driven in-process by the renderer
        new SpringApplicationBuilder(ChromatraceApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
