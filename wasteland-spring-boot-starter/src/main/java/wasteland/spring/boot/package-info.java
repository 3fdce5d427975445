/**
 * Spring Boot auto-configuration for the wanted-board client.
 *
 * <p>{@link wasteland.spring.boot.WastelandAutoConfiguration} wires a
 * {@link wasteland.WastelandClient} and a {@link wasteland.Workspace} from
 * {@code wasteland.*} application properties and the application's {@code DataSource}.
 *
 * @see wasteland.spring.boot.WastelandAutoConfiguration
 * @see wasteland.spring.boot.WastelandProperties
 */
package wasteland.spring.boot;
