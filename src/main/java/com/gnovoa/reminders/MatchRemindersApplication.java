// Namespace
package com.gnovoa.reminders;

// Imports
import com.gnovoa.reminders.config.ProviderProperties;
import com.gnovoa.reminders.config.ReminderProperties;
import com.gnovoa.reminders.config.TelegramProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties({
  ReminderProperties.class,
  ProviderProperties.class,
  TelegramProperties.class
})
public class MatchRemindersApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchRemindersApplication.class, args);
  }
}
