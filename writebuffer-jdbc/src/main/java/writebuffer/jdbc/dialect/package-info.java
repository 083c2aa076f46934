/**
 * Built-in SQL dialects and their {@link java.util.ServiceLoader} registry.
 *
 * @see writebuffer.jdbc.dialect.Dialects
 */
package writebuffer.jdbc.dialect;
