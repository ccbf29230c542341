/**
 * Game services implementation module.
 *
 * <p>Provides the in-memory services and the default capability host.</p>
 */
module gameservices.impl
{
    requires gameservices.api;
    requires org.slf4j;

    exports org.abstractica.gameservices.impl.host;
    exports org.abstractica.gameservices.impl.world;
    exports org.abstractica.gameservices.impl.chat;
    exports org.abstractica.gameservices.impl.inventory;
    exports org.abstractica.gameservices.impl.matchmaking;
}
