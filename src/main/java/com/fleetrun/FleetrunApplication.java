package com.fleetrun;

import com.fleetrun.worker.runtime.WorkerMain;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

import java.util.Arrays;

@SpringBootApplication
public class FleetrunApplication {

    static final String WORKER_MODE = "worker";

    public static void main(String[] args) {
        // A packaged jar is its own worker: `java -jar fleetrun.jar worker`.
        // Workers speak the stdio protocol and never start a Spring context.
        if (isWorkerMode(args)) {
            WorkerMain.main(Arrays.copyOfRange(args, 1, args.length));
            return;
        }

        SpringApplicationBuilder builder = new SpringApplicationBuilder(FleetrunApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                );

        ApplicationContext ctx = builder.run(args);

        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        System.exit(SpringApplication.exit(ctx, exitCodeGen));
    }

    static boolean isWorkerMode(String[] args) {
        return args.length > 0 && WORKER_MODE.equals(args[0]);
    }
}
