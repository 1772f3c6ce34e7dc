/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.taskslot.app;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the properties file holding the whole configuration. The {@value #CONFIGURATION_PATH_PROPERTY} system
 * property wins over the {@value #CLASSPATH_RESOURCE} classpath resource. Without either, every key takes its
 * default value.
 */
public class ConfigurationLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final String CONFIGURATION_PATH_PROPERTY = "taskslot.configuration";
    public static final String CLASSPATH_RESOURCE = "taskslot.properties";

    public static Configuration load() throws ConfigurationException {
        Optional<Path> path = Optional.ofNullable(System.getProperty(CONFIGURATION_PATH_PROPERTY)).map(Path::of);
        if (path.isPresent()) {
            return fromFile(path.get());
        }
        return fromClasspath(CLASSPATH_RESOURCE);
    }

    public static Configuration fromFile(Path path) throws ConfigurationException {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file " + path.toAbsolutePath() + " does not exist");
        }
        LOGGER.info("Loading configuration from {}", path.toAbsolutePath());
        PropertiesConfiguration configuration = new PropertiesConfiguration();
        new FileHandler(configuration).load(path.toFile());
        return configuration;
    }

    public static Configuration fromClasspath(String resource) throws ConfigurationException {
        try (InputStream inputStream = ConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                LOGGER.warn("No {} found on the classpath, using default configuration", resource);
                return new BaseConfiguration();
            }
            LOGGER.info("Loading configuration from classpath resource {}", resource);
            PropertiesConfiguration configuration = new PropertiesConfiguration();
            new FileHandler(configuration).load(inputStream);
            return configuration;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read classpath resource " + resource, e);
        }
    }
}
