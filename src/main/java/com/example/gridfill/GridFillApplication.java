package com.example.gridfill;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@EnableCaching
@SpringBootApplication
public class GridFillApplication {

	public static void main(String[] args) {
		SpringApplication.run(GridFillApplication.class, args);
	}

}
