package org.gungame.server.weapon;

import com.fasterxml.jackson.core.type.TypeReference;
import org.gungame.protocol.serialization.MessageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup table from weapon id to {@link WeaponData}.
 *
 * <p>Loaded once at startup and shared without locking.</p>
 */
public final class WeaponDatabase
{
    private static final Logger LOG = LoggerFactory.getLogger(WeaponDatabase.class);

    /**
     * Weapon id meaning "no weapon equipped".
     */
    public static final int NO_WEAPON = 0;

    /**
     * Classpath resource holding the built-in weapon table.
     */
    public static final String DEFAULT_RESOURCE = "weapons.json";

    private final Map<Integer, WeaponData> weapons;

    private WeaponDatabase(Map<Integer, WeaponData> weapons)
    {
        this.weapons = Collections.unmodifiableMap(weapons);
    }

    /**
     * Creates a database from the given weapons.
     *
     * @param weapons the weapons, ids must be unique
     * @return the database
     * @throws IllegalArgumentException if two weapons share an id
     */
    public static WeaponDatabase of(Collection<WeaponData> weapons)
    {
        Map<Integer, WeaponData> byId = new LinkedHashMap<>();
        for (WeaponData weapon : weapons)
        {
            if (byId.putIfAbsent(weapon.id(), weapon) != null)
            {
                throw new IllegalArgumentException("Duplicate weapon id: " + weapon.id());
            }
        }
        return new WeaponDatabase(byId);
    }

    /**
     * Loads the built-in weapon table from the classpath.
     *
     * @return the database
     * @throws UncheckedIOException if the resource is missing or invalid
     */
    public static WeaponDatabase load()
    {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Loads a weapon table from a file or a classpath resource.
     *
     * <p>A location naming an existing regular file is read from disk;
     * anything else is looked up on the classpath.</p>
     *
     * @param location file path or resource name
     * @return the database
     * @throws UncheckedIOException if the table is missing or invalid
     */
    public static WeaponDatabase load(String location)
    {
        Path file = asFile(location);
        try (InputStream in = file != null
                ? Files.newInputStream(file)
                : WeaponDatabase.class.getClassLoader().getResourceAsStream(location))
        {
            if (in == null)
            {
                throw new IOException("Weapon table not found as file or classpath resource: " + location);
            }
            WeaponDatabase database = read(in);
            LOG.info("Loaded {} weapons from {}", database.size(), file != null ? file : "classpath:" + location);
            return database;
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to load weapon table " + location, e);
        }
    }

    private static Path asFile(String location)
    {
        try
        {
            Path path = Path.of(location);
            return Files.isRegularFile(path) ? path : null;
        }
        catch (InvalidPathException e)
        {
            return null;
        }
    }

    /**
     * Reads a weapon table from a JSON array.
     *
     * @param in stream holding the JSON
     * @return the database
     * @throws IOException if the JSON is invalid
     */
    public static WeaponDatabase read(InputStream in) throws IOException
    {
        List<WeaponData> list = MessageCodec.mapper().readValue(in, new TypeReference<List<WeaponData>>() {});
        return of(list);
    }

    /**
     * Looks up a weapon.
     *
     * @param id weapon id
     * @return the weapon, or empty if unknown
     */
    public Optional<WeaponData> get(int id)
    {
        return Optional.ofNullable(weapons.get(id));
    }

    /**
     * Returns whether a weapon id is known.
     *
     * @param id weapon id
     * @return true if present
     */
    public boolean contains(int id)
    {
        return weapons.containsKey(id);
    }

    /**
     * Returns all weapons in table order.
     *
     * @return unmodifiable collection
     */
    public Collection<WeaponData> all()
    {
        return weapons.values();
    }

    public int size()
    {
        return weapons.size();
    }
}
