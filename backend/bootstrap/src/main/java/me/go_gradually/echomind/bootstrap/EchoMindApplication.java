package me.go_gradually.echomind.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.echomind")
public class EchoMindApplication {
    public static void main(String[] args) {
        SpringApplication.run(EchoMindApplication.class, args);
    }
}
