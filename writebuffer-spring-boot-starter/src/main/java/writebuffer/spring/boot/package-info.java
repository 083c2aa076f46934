/**
 * Spring Boot auto-configuration for the write buffer.
 *
 * <p>Add {@code writebuffer-spring-boot-starter} next to a {@link javax.sql.DataSource}
 * and inject {@link writebuffer.WriteRecorder}. Settings are bound from
 * {@code writebuffer.*}; see {@link writebuffer.spring.boot.WriteBufferProperties}.
 */
package writebuffer.spring.boot;
