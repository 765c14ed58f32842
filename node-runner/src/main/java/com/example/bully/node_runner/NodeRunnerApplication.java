package com.example.bully.node_runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@EnableConfigurationProperties
@ComponentScan(basePackages = {
		"com.example.bully.node_runner",
		"com.example.bully.networking.http"
})
public class NodeRunnerApplication {

	public static void main(String[] args) {
		SpringApplication.run(NodeRunnerApplication.class, args);
	}

}
