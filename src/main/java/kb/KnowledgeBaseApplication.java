package kb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeBaseApplication {
  public static void main(String[] args) {
    SpringApplication.run(KnowledgeBaseApplication.class, args);
  }
}
