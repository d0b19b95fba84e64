package com.sandy.fleet.view;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FleetDeviceViewApplication {

	public static void main(String[] args) {
		SpringApplication.run(FleetDeviceViewApplication.class, args);
	}

}
