package my.adsoptimizer.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.sql.DataSource;

/**
 * Waits for the database, applies the Liquibase changelog and makes the JPA layer start after it.
 */
@Configuration
public class DatabaseConfig {
	static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";
	private static final List<String> JPA_BEANS = List.of("entityManagerFactory", "jpaSharedEM_entityManagerFactory");

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource,
															 @Value("${app.database.startup-timeout-seconds:60}") int timeoutSeconds) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(timeoutSeconds);
		validator.setInterval(2);
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource,
									 @Value("${spring.liquibase.change-log:" + DEFAULT_CHANGE_LOG + "}") String changeLog,
									 @Value("${spring.liquibase.enabled:true}") boolean enabled) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGE_LOG : changeLog);
		liquibase.setShouldRun(enabled);
		return liquibase;
	}

	@Bean
	public static BeanFactoryPostProcessor liquibaseBeforeJpa() {
		return beanFactory -> JPA_BEANS.forEach(name -> dependOnLiquibase(beanFactory, name));
	}

	private static void dependOnLiquibase(ConfigurableListableBeanFactory beanFactory, String beanName) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> dependsOn = new LinkedHashSet<>();
		if (definition.getDependsOn() != null) {
			dependsOn.addAll(List.of(definition.getDependsOn()));
		}
		dependsOn.add("liquibase");
		definition.setDependsOn(dependsOn.toArray(new String[0]));
	}
}
