/*
 * Copyright (c) 2025 Pushgate Contributors
 * Licensed under the Apache License 2.0
 */
package io.pushgate.spring;

import io.pushgate.spring.cli.CommandArgs;
import java.util.Arrays;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PushgateApplication {

    public static void main(String[] args) {
        String[] effective = args;
        if (CommandArgs.isVerbose(args)) {
            effective = Arrays.copyOf(args, args.length + 1);
            effective[args.length] = "--pushgate.verbose=true";
        }
        System.exit(SpringApplication.exit(SpringApplication.run(PushgateApplication.class, effective)));
    }
}
