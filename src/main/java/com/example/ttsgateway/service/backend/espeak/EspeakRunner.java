package com.example.ttsgateway.service.backend.espeak;

import java.util.List;

/**
 * Runs the local synthesizer executable and returns its standard output.
 */
@FunctionalInterface
interface EspeakRunner {

    /**
     * @param args  arguments after the executable name
     * @param stdin bytes written to the process input, or {@code null} for none
     * @throws EspeakException if the process cannot be started, times out or exits non-zero
     */
    byte[] run(List<String> args, byte[] stdin);
}
