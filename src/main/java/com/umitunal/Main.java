package com.umitunal;

import com.umitunal.examples.MessageSendingExample;

/**
 * Runs the durable job queue examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== Durable Job Queue Examples ===\n");

        MessageSendingExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
