package pycs;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import pycs.model.csharp.CsMemberAttribute;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Logger;

// Options that steer how the code generator shapes the C# code model. They are read
// from the "codegen" object of a JSON configuration file; every field is optional and
// falls back to the bundled codegen-defaults.json.
public class CodeGenOptions {
	public static final String CODEGEN_FIELD = "codegen";

	private static final String DEFAULTS_RESOURCE = "codegen-defaults.json";
	private static final Logger logger = Logger.getLogger(CodeGenOptions.class.getName());

	private static CodeGenOptions defaults;

	private final String initModuleName;
	private final String collectionsNamespace;
	private final String escapeMarker;
	private final String defaultMemberType;
	private final EnumSet<CsMemberAttribute> moduleAttributes;

	private CodeGenOptions(String initModuleName, String collectionsNamespace, String escapeMarker,
	                       String defaultMemberType, EnumSet<CsMemberAttribute> moduleAttributes) {
		this.initModuleName = initModuleName;
		this.collectionsNamespace = collectionsNamespace;
		this.escapeMarker = escapeMarker;
		this.defaultMemberType = defaultMemberType;
		this.moduleAttributes = moduleAttributes;
	}

	public static synchronized CodeGenOptions defaults() {
		if (defaults == null) {
			try (InputStream is = CodeGenOptions.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
				if (is == null) {
					throw new InternalCompilerError("missing " + DEFAULTS_RESOURCE);
				}
				JSONObject config = new JSONObject(IOUtils.toString(is, StandardCharsets.UTF_8));
				defaults = fromJSON(config.getJSONObject(CODEGEN_FIELD), null);
			} catch (IOException | JSONException e) {
				throw new InternalCompilerError(e);
			}
		}
		return defaults;
	}

	public static CodeGenOptions fromFile(File configFile) {
		String s;
		try {
			s = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new CodeGenOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new CodeGenOptionException(configFile + ": parsing error: " + e.getMessage(), e);
		}

		logger.info("Loaded code generation options from \"" + configFile + "\"");
		return fromConfig(config);
	}

	// reads the "codegen" object of a whole configuration document; a document without one
	// yields the defaults
	public static CodeGenOptions fromConfig(JSONObject config) {
		if (!config.has(CODEGEN_FIELD)) {
			return defaults();
		}
		try {
			return fromJSON(config.getJSONObject(CODEGEN_FIELD), defaults());
		} catch (JSONException e) {
			throw new CodeGenOptionException(e.getMessage(), e);
		}
	}

	private static CodeGenOptions fromJSON(JSONObject codegen, CodeGenOptions fallback) {
		String initModuleName = getString(codegen, "init_module_name",
				fallback == null ? null : fallback.initModuleName);
		String collectionsNamespace = getString(codegen, "collections_namespace",
				fallback == null ? null : fallback.collectionsNamespace);
		String escapeMarker = getString(codegen, "escape_marker",
				fallback == null ? null : fallback.escapeMarker);
		String defaultMemberType = getString(codegen, "default_member_type",
				fallback == null ? null : fallback.defaultMemberType);

		if (escapeMarker.isEmpty()) {
			throw new CodeGenOptionException("escape_marker must not be empty");
		}

		EnumSet<CsMemberAttribute> moduleAttributes;
		if (codegen.has("module_attributes")) {
			moduleAttributes = EnumSet.noneOf(CsMemberAttribute.class);
			JSONArray attributes = codegen.getJSONArray("module_attributes");
			for (int i = 0; i < attributes.length(); i++) {
				String attribute = attributes.getString(i);
				try {
					moduleAttributes.add(CsMemberAttribute.valueOf(attribute));
				} catch (IllegalArgumentException e) {
					throw new CodeGenOptionException("unknown member attribute " + attribute, e);
				}
			}
		} else if (fallback != null) {
			moduleAttributes = EnumSet.copyOf(fallback.moduleAttributes);
		} else {
			throw new CodeGenOptionException("module_attributes is required");
		}
		if (!moduleAttributes.contains(CsMemberAttribute.STATIC)) {
			throw new CodeGenOptionException("module_attributes must include STATIC");
		}

		return new CodeGenOptions(initModuleName, collectionsNamespace, escapeMarker, defaultMemberType,
				moduleAttributes);
	}

	private static String getString(JSONObject codegen, String key, String fallback) {
		if (codegen.has(key)) {
			Object value = codegen.get(key);
			if (!(value instanceof String)) {
				throw new CodeGenOptionException(key + " must be a string");
			}
			return (String) value;
		}
		if (fallback == null) {
			throw new CodeGenOptionException(key + " is required");
		}
		return fallback;
	}

	// name of the module whose declarations become top-level namespace members
	public String getInitModuleName() {
		return initModuleName;
	}

	public String getCollectionsNamespace() {
		return collectionsNamespace;
	}

	public String getEscapeMarker() {
		return escapeMarker;
	}

	public String getDefaultMemberType() {
		return defaultMemberType;
	}

	public Set<CsMemberAttribute> getModuleAttributes() {
		return EnumSet.copyOf(moduleAttributes);
	}
}
