package com.labshare.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LabShareApplication {

	public static void main(String[] args) {
		// OTP windows and session retention are computed in UTC
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(LabShareApplication.class, args);
	}

}
