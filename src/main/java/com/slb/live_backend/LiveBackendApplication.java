package com.slb.live_backend;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.slb.live_backend")
@MapperScan("com.slb.live_backend.modules.*.mapper")
public class LiveBackendApplication {

	public static void main(String[] args) {
		SpringApplication.run(LiveBackendApplication.class, args);
	}

}
