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

package icebergarea.lib.regression;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapterFactory;

import icebergarea.lib.io.GsonTools;
import icebergarea.lib.io.GsonTools.SubTypeAdapterFactory;

/**
 * Helper methods for reading and writing {@link AreaModel} artifacts as JSON.
 * <p>
 * The concrete model type is stored in a {@code model_type} field.
 */
public class AreaModels {
	
	private static final String TYPE_FIELD = "model_type";
	
	private static final SubTypeAdapterFactory<AreaModel> factory = 
			GsonTools.createSubTypeAdapterFactory(AreaModel.class, TYPE_FIELD)
				.registerSubtype(LinearAreaModel.class, "linear")
				.registerAlias(LinearAreaModel.class, "LinearAreaModel");
	
	private AreaModels() {
		throw new AssertionError();
	}
	
	/**
	 * Get a {@link TypeAdapterFactory} to handle {@link AreaModel} instances.
	 * @return
	 */
	public static TypeAdapterFactory getTypeAdapterFactory() {
		return factory;
	}
	
	/**
	 * Register a new {@link AreaModel} subtype for JSON serialization.
	 * @param cls
	 * @param label value of the {@code model_type} field for this subtype
	 */
	public static void registerSubtype(Class<? extends AreaModel> cls, String label) {
		factory.registerSubtype(cls, label);
	}
	
	private static Gson getGson(boolean pretty) {
		return GsonTools.getInstance(pretty).newBuilder()
				.registerTypeAdapterFactory(factory)
				.create();
	}
	
	/**
	 * Read a model from a JSON file.
	 * @param path
	 * @return
	 * @throws IOException if the file cannot be read or does not contain a supported model
	 */
	public static AreaModel readModel(Path path) throws IOException {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			var model = getGson(false).fromJson(reader, AreaModel.class);
			if (model == null)
				throw new IOException("No area model found in " + path);
			return validate(model);
		} catch (JsonParseException | IllegalArgumentException e) {
			throw new IOException("Unable to read area model from " + path + ": " + e.getLocalizedMessage(), e);
		}
	}
	
	/**
	 * Write a model to a JSON file.
	 * @param model
	 * @param path
	 * @throws IOException
	 */
	public static void writeModel(AreaModel model, Path path) throws IOException {
		try (var writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			getGson(true).toJson(model, AreaModel.class, writer);
		}
	}
	
	/**
	 * Convert a model to a JSON string.
	 * @param model
	 * @return
	 */
	public static String toJson(AreaModel model) {
		return getGson(true).toJson(model, AreaModel.class);
	}
	
	/**
	 * Parse a model from a JSON string.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON does not describe a supported model
	 * @throws IllegalArgumentException if the model is invalid
	 */
	public static AreaModel fromJson(String json) {
		var model = getGson(false).fromJson(json, AreaModel.class);
		if (model == null)
			throw new JsonParseException("No area model found");
		return validate(model);
	}
	
	private static AreaModel validate(AreaModel model) {
		if (model instanceof LinearAreaModel)
			((LinearAreaModel)model).validate();
		return model;
	}

}
