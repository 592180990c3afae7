package com.sashkomusic.keytagger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KeyTaggerApplication {

	public static void main(String[] args) {
		// one-shot run: close the context once the runner is done
		System.exit(SpringApplication.exit(SpringApplication.run(KeyTaggerApplication.class, args)));
	}

}
