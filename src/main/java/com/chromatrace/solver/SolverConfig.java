package com.chromatrace.solver;

import com.chromatrace.ChromatraceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SolverConfig {

    /**
     * The clang + KLEE driver. Fails context startup with a
     * {@link ToolchainConfigurationException} when the toolchain is missing.
     */
    @Bean
    public SolverDriver solverDriver(ChromatraceProperties properties) {
        return new KleeSolverDriver(properties.getSolver());
    }
}
