package com.facilityops.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FacilityOpsApplication {

	public static void main(String[] args) {
		// 로그와 토큰 만료 계산을 UTC로 통일
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(FacilityOpsApplication.class, args);
	}

}
