package com.openforge.dnd.bootstrap;

/**
 * The TOML file written by setup.sh:
 *
 * [credentials]
 * name = "root"
 * pass = "<64 hex chars>"
 */
public record RootCredentialDescriptor(Credentials credentials) {

    public record Credentials(String name, String pass) {

        @Override
        public String toString() {
            return "Credentials[name=" + name + ", pass=***]";
        }
    }
}
