package com.umitunal;

import com.umitunal.examples.*;

/**
 * Main class that runs all cronq examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== cronq Examples ===\n");

        OneTimeJobsExample.main(args);
        RecurringJobsExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
