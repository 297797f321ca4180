package org.smileyface.leaguecrawler;

import org.smileyface.leaguecrawler.crawler.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class LeagueCrawlerApplication {

	public static void main(String[] args) {
		System.exit(SpringApplication.exit(SpringApplication.run(LeagueCrawlerApplication.class, args)));
	}
}
