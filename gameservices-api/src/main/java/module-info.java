/**
 * Game services API module.
 *
 * <p>Provides the capability interfaces, value types and host API for the
 * entity world, chat, inventory and matchmaking services.</p>
 */
module gameservices.api
{
    exports org.abstractica.gameservices;
    exports org.abstractica.gameservices.handlers;
    exports org.abstractica.gameservices.world;
    exports org.abstractica.gameservices.chat;
    exports org.abstractica.gameservices.inventory;
    exports org.abstractica.gameservices.matchmaking;
}
