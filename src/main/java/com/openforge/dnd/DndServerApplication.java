package com.openforge.dnd;

import com.openforge.dnd.auth.HashingLaneProperties;
import com.openforge.dnd.auth.PasswordProperties;
import com.openforge.dnd.auth.SessionProperties;
import com.openforge.dnd.bootstrap.BootstrapProperties;
import com.openforge.dnd.config.TlsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * A server that hosts a website to play DnD with your friends.
 *
 * Every setting is a Spring property and can be given on the command line, e.g.
 * {@code --dnd.data-path=/data/data.db --dnd.client-path=/home/dnd/client --dnd.log-level=DEBUG}.
 */
@SpringBootApplication
@EnableConfigurationProperties({
        SessionProperties.class,
        PasswordProperties.class,
        HashingLaneProperties.class,
        BootstrapProperties.class,
        TlsProperties.class
})
public class DndServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DndServerApplication.class, args);
    }
}
