/*-
 * #%L
 * This file is part of IcebergArea.
 * %%
 * Copyright (C) 2024 IcebergArea developers
 * %%
 * IcebergArea is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * IcebergArea is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with IcebergArea.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package icebergarea.lib.classifiers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import icebergarea.lib.io.GsonTools;
import icebergarea.lib.io.GsonTools.SubTypeAdapterFactory;

/**
 * Helper methods for reading and writing {@link IcebergClassifier} artifacts as JSON.
 * <p>
 * The concrete classifier type is stored in a {@code classifier_type} field.
 */
public class IcebergClassifiers {
	
	private static final SubTypeAdapterFactory<IcebergClassifier> factory = 
			GsonTools.createSubTypeAdapterFactory(IcebergClassifier.class, "classifier_type")
				.registerSubtype(ReferenceStatisticsClassifier.class, "reference_statistics");
	
	private IcebergClassifiers() {
		throw new AssertionError();
	}
	
	private static Gson getGson(boolean pretty) {
		return GsonTools.getInstance(pretty).newBuilder()
				.registerTypeAdapterFactory(factory)
				.create();
	}
	
	/**
	 * Read a classifier from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or does not contain a supported classifier
	 */
	public static IcebergClassifier readClassifier(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			var classifier = getGson(false).fromJson(reader, IcebergClassifier.class);
			if (classifier == null)
				throw new IOException("No classifier found in " + path);
			return validate(classifier);
		} catch (JsonParseException | IllegalArgumentException e) {
			throw new IOException("Unable to read classifier from " + path + ": " + e.getLocalizedMessage(), e);
		}
	}
	
	/**
	 * Write a classifier to a JSON file.
	 * @param classifier
	 * @param path
	 * @throws IOException
	 */
	public static void writeClassifier(IcebergClassifier classifier, Path path) throws IOException {
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			getGson(true).toJson(classifier, IcebergClassifier.class, writer);
		}
	}
	
	/**
	 * Convert a classifier to a JSON string.
	 * @param classifier
	 * @return
	 */
	public static String toJson(IcebergClassifier classifier) {
		return getGson(true).toJson(classifier, IcebergClassifier.class);
	}
	
	private static IcebergClassifier validate(IcebergClassifier classifier) {
		if (classifier instanceof ReferenceStatisticsClassifier)
			((ReferenceStatisticsClassifier)classifier).validate();
		return classifier;
	}

}
