package movies.catalog.mcp.schemas;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import movies.catalog.mcp.base.MCPTool;

import java.util.ArrayList;
import java.util.List;

/**
 * Input schemas of every tool the movie catalog exposes. The validation server checks
 * arbitrary calls against {@link #allTools()}; the context server registers
 * {@link #contextTools()} itself.
 */
public final class CatalogToolSchemas {

    private CatalogToolSchemas() {
    }

    public static List<MCPTool> allTools() {
        List<MCPTool> all = new ArrayList<>();
        all.addAll(movieTools());
        all.addAll(actorTools());
        all.addAll(searchTools());
        all.addAll(compoundTools());
        all.addAll(contextTools());
        all.add(validateToolCallTool());
        return all;
    }

    /* ---------- movies ---------- */

    public static List<MCPTool> movieTools() {
        return List.of(
            new MCPTool("get_movie", "Get a movie by ID",
                objectSchema(new JsonObject()
                    .put("movie_id", integer("The movie ID")), "movie_id")),
            new MCPTool("add_movie", "Add a new movie to the database",
                objectSchema(movieProperties(), "title", "director", "year")),
            new MCPTool("update_movie", "Update an existing movie",
                objectSchema(movieProperties()
                    .put("id", integer("Movie ID")), "id", "title", "director", "year")),
            new MCPTool("delete_movie", "Delete a movie by ID",
                objectSchema(new JsonObject()
                    .put("movie_id", integer("The movie ID to delete")), "movie_id")),
            new MCPTool("list_top_movies", "Get top-rated movies",
                objectSchema(new JsonObject()
                    .put("limit", integer("Number of movies to return").put("default", 10).put("minimum", 1)
                        .put("maximum", 1000))))
        );
    }

    private static JsonObject movieProperties() {
        return new JsonObject()
            .put("title", string("Movie title").put("minLength", 1).put("maxLength", 255))
            .put("director", string("Movie director").put("minLength", 1).put("maxLength", 255))
            .put("year", integer("Release year").put("minimum", 1888).put("maximum", 2100))
            .put("rating", rating("Movie rating (0-10)"))
            .put("genres", new JsonObject()
                .put("type", "array")
                .put("description", "List of genres")
                .put("items", new JsonObject().put("type", "string")))
            .put("poster_url", string("URL to movie poster").put("format", "uri"));
    }

    /* ---------- actors ---------- */

    public static List<MCPTool> actorTools() {
        return List.of(
            new MCPTool("add_actor", "Add a new actor to the database",
                objectSchema(actorProperties(), "name", "birth_year")),
            new MCPTool("get_actor", "Get an actor by ID",
                objectSchema(new JsonObject()
                    .put("actor_id", integer("The actor ID")), "actor_id")),
            new MCPTool("update_actor", "Update an existing actor",
                objectSchema(actorProperties()
                    .put("id", integer("Actor ID")), "id", "name", "birth_year")),
            new MCPTool("delete_actor", "Delete an actor by ID",
                objectSchema(new JsonObject()
                    .put("actor_id", integer("The actor ID to delete")), "actor_id")),
            new MCPTool("link_actor_to_movie", "Link an actor to a movie",
                objectSchema(actorMovieLink(), "actor_id", "movie_id")),
            new MCPTool("unlink_actor_from_movie", "Unlink an actor from a movie",
                objectSchema(actorMovieLink(), "actor_id", "movie_id")),
            new MCPTool("get_movie_cast", "Get all actors in a movie",
                objectSchema(new JsonObject()
                    .put("movie_id", integer("Movie ID")), "movie_id")),
            new MCPTool("get_actor_movies", "Get all movies for an actor",
                objectSchema(new JsonObject()
                    .put("actor_id", integer("Actor ID")), "actor_id")),
            new MCPTool("search_actors", "Search actors by name",
                objectSchema(new JsonObject()
                    .put("name", string("Actor name to search for").put("minLength", 1)), "name"))
        );
    }

    private static JsonObject actorProperties() {
        return new JsonObject()
            .put("name", string("Actor name").put("minLength", 1).put("maxLength", 255))
            .put("birth_year", integer("Birth year").put("minimum", 1800).put("maximum", 2100))
            .put("bio", string("Actor biography"));
    }

    private static JsonObject actorMovieLink() {
        return new JsonObject()
            .put("actor_id", integer("Actor ID"))
            .put("movie_id", integer("Movie ID"));
    }

    /* ---------- search ---------- */

    public static List<MCPTool> searchTools() {
        return List.of(
            new MCPTool("search_movies", "Search for movies by various criteria",
                objectSchema(new JsonObject()
                    .put("title", string("Search by title"))
                    .put("director", string("Search by director"))
                    .put("genre", string("Search by genre"))
                    .put("min_year", integer("Minimum release year"))
                    .put("max_year", integer("Maximum release year"))
                    .put("min_rating", rating("Minimum rating"))
                    .put("max_rating", rating("Maximum rating"))
                    .put("limit", integer("Maximum number of results").put("default", 50).put("minimum", 1)
                        .put("maximum", 1000)))),
            new MCPTool("search_by_decade", "Search movies by decade (e.g., '1990s', '2000s')",
                objectSchema(new JsonObject()
                    .put("decade", string("Decade to search (e.g., '1990s', '2000s')")
                        .put("minLength", 3).put("maxLength", 5)), "decade")),
            new MCPTool("search_by_rating_range", "Search movies within a specific rating range",
                objectSchema(new JsonObject()
                    .put("min_rating", rating("Minimum rating (0-10)"))
                    .put("max_rating", rating("Maximum rating (0-10)")), "min_rating", "max_rating")),
            new MCPTool("search_similar_movies", "Find movies similar to a given movie",
                objectSchema(new JsonObject()
                    .put("movie_id", integer("Reference movie ID"))
                    .put("limit", integer("Number of similar movies to return").put("default", 5)), "movie_id"))
        );
    }

    /* ---------- compound ---------- */

    public static List<MCPTool> compoundTools() {
        JsonObject importedMovie = new JsonObject()
            .put("type", "object")
            .put("properties", new JsonObject()
                .put("title", new JsonObject().put("type", "string"))
                .put("director", new JsonObject().put("type", "string"))
                .put("year", new JsonObject().put("type", "integer"))
                .put("rating", rating("Movie rating (0-10)"))
                .put("release_date", string("Release date").put("format", "date")))
            .put("required", new JsonArray().add("title").add("director").add("year"));

        return List.of(
            new MCPTool("bulk_movie_import", "Import multiple movies at once",
                objectSchema(new JsonObject()
                    .put("movies", new JsonObject()
                        .put("type", "array")
                        .put("description", "Array of movies to import")
                        .put("minItems", 1)
                        .put("maxItems", 1000)
                        .put("items", importedMovie)), "movies")),
            new MCPTool("movie_recommendation_engine", "Get movie recommendations based on preferences",
                objectSchema(new JsonObject()
                    .put("user_preferences", new JsonObject()
                        .put("type", "object")
                        .put("description", "User preferences for recommendations")
                        .put("properties", new JsonObject()
                            .put("genres", new JsonObject()
                                .put("type", "array")
                                .put("items", new JsonObject().put("type", "string")))
                            .put("min_rating", rating("Minimum rating"))
                            .put("include_watched", new JsonObject().put("type", "boolean")))), "user_preferences")),
            new MCPTool("director_career_analysis", "Analyze a director's career trajectory",
                objectSchema(new JsonObject()
                    .put("director_name", string("Director name to analyze").put("minLength", 1)), "director_name"))
        );
    }

    /* ---------- result contexts ---------- */

    public static List<MCPTool> contextTools() {
        return List.of(
            new MCPTool("get_context_page", "Get a page of results from a search context",
                objectSchema(new JsonObject()
                    .put("context_id", string("Context ID").put("minLength", 1))
                    .put("page", integer("Page number (clamped to the available range)"))
                    .put("page_size", integer("Optional page size override for this request")), "context_id", "page")),
            new MCPTool("get_context_info", "Get information about a search context",
                objectSchema(new JsonObject()
                    .put("context_id", string("Context ID").put("minLength", 1)), "context_id")),
            new MCPTool("delete_context", "Release a search context before it expires",
                objectSchema(new JsonObject()
                    .put("context_id", string("Context ID").put("minLength", 1)), "context_id"))
        );
    }

    /* ---------- validation ---------- */

    public static MCPTool validateToolCallTool() {
        return new MCPTool("validate_tool_call", "Validate a tool call against its schema",
            objectSchema(new JsonObject()
                .put("tool_name", string("Tool name to validate").put("minLength", 1))
                .put("arguments", new JsonObject()
                    .put("type", "object")
                    .put("description", "Arguments to validate")), "tool_name", "arguments"));
    }

    /* ---------- fragments ---------- */

    static JsonObject objectSchema(JsonObject properties, String... required) {
        JsonArray requiredArray = new JsonArray();
        for (String name : required) {
            requiredArray.add(name);
        }
        return new JsonObject()
            .put("type", "object")
            .put("properties", properties)
            .put("required", requiredArray);
    }

    private static JsonObject string(String description) {
        return new JsonObject().put("type", "string").put("description", description);
    }

    private static JsonObject integer(String description) {
        return new JsonObject().put("type", "integer").put("description", description);
    }

    private static JsonObject rating(String description) {
        return new JsonObject()
            .put("type", "number")
            .put("description", description)
            .put("minimum", 0)
            .put("maximum", 10);
    }
}
