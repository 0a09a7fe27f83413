package com.example.fundraisingdashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundraisingDashboardApplication {

	public static void main(String[] args) {
		SpringApplication.run(FundraisingDashboardApplication.class, args);
	}

}
